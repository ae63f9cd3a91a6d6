/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of DarkTrack
 *
 * DarkTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DarkTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DarkTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package darktrack.utils;

import java.util.Objects;

/**
 *
 * @author Jean Ollion
 */
public class Pair<K, V> {
    public K key;
    public V value;
    public Pair(K key, V value) {
        this.key=key;
        this.value=value;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + (this.key != null ? this.key.hashCode() : 0);
        hash = 29 * hash + (this.value != null ? this.value.hashCode() : 0);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) return false;
        if (getClass() == obj.getClass()) {
            final Pair<?, ?> other = (Pair<?, ?>) obj;
            return Objects.equals(key, other.key) && Objects.equals(value, other.value);
        } else return false;
    }
    @Override 
    public String toString() {
        return "{"+(key==null?"null":key.toString())+"->"+(value==null?"null":value.toString())+"}";
    }
}
