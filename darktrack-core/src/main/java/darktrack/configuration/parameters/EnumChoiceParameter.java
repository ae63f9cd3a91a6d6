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
package darktrack.configuration.parameters;

import java.util.Arrays;

/**
 *
 * @author Jean Ollion
 */
public class EnumChoiceParameter<E extends Enum<E>> extends ParameterImpl<EnumChoiceParameter<E>> {
    final E[] enumChoiceList;
    E selectedItem;

    public EnumChoiceParameter(String name, E[] enumChoiceList, E selectedItem) {
        super(name);
        this.enumChoiceList=enumChoiceList;
        this.selectedItem = selectedItem;
    }

    public E[] getEnumChoiceList() {
        return Arrays.copyOf(enumChoiceList, enumChoiceList.length);
    }

    public E getSelectedEnum() {
        return selectedItem;
    }

    public EnumChoiceParameter<E> setSelectedEnum(E selectedEnum) {
        this.selectedItem = selectedEnum;
        return this;
    }

    @Override
    public boolean isSet() {
        return selectedItem!=null;
    }

    @Override
    public boolean isValid() {
        return super.isValid() && selectedItem!=null;
    }

    @Override
    public Object toJSONEntry() {
        return selectedItem==null ? null : selectedItem.name();
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry==null) {
            selectedItem = null;
            return;
        }
        String s = jsonEntry.toString();
        selectedItem = Arrays.stream(enumChoiceList).filter(e->e.name().equalsIgnoreCase(s)).findAny()
                .orElseThrow(()->new IllegalArgumentException("Parameter "+name+": unknown choice: "+s+" allowed: "+Arrays.toString(enumChoiceList)));
    }

    @Override
    public String toString() {
        return name+": "+(selectedItem==null ? "" : selectedItem.name());
    }
}
