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
package darktrack.image;

/**
 *
 * @author Jean Ollion
 */
public class SimpleImageProperties implements ImageProperties {
    protected String name;
    protected final int sizeX, sizeY, sizeZ, sizeXY;

    public SimpleImageProperties(String name, int sizeX, int sizeY, int sizeZ) {
        if (sizeX<0 || sizeY<0 || sizeZ<0) throw new IllegalArgumentException("Negative image size: "+sizeX+"x"+sizeY+"x"+sizeZ);
        this.name = name;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeZ = sizeZ;
        this.sizeXY = sizeX * sizeY;
    }

    public SimpleImageProperties(ImageProperties properties) {
        this(properties.getName(), properties.sizeX(), properties.sizeY(), properties.sizeZ());
    }

    @Override public String getName() {return name;}
    @Override public int sizeX() {return sizeX;}
    @Override public int sizeY() {return sizeY;}
    @Override public int sizeZ() {return sizeZ;}
    @Override public int sizeXY() {return sizeXY;}
    @Override public int sizeXYZ() {return sizeXY * sizeZ;}

    public boolean contains(int x, int y, int z) {
        return x>=0 && x<sizeX && y>=0 && y<sizeY && z>=0 && z<sizeZ;
    }

    @Override
    public String toString() {
        return name+" ["+sizeX+"x"+sizeY+"x"+sizeZ+"]";
    }
}
