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
package darktrack.data_structure;

import darktrack.image.ImageInt;
import darktrack.image.ImageMask;

import java.util.Arrays;

/**
 * 2D connected set of pixels, stored as sorted linear indices (x + y * sizeX)
 * @author Jean Ollion
 */
public class Region implements ImageMask {
    final int label;
    final int[] pixels;
    final int sizeX, sizeY;

    public Region(int label, int[] pixels, int sizeX, int sizeY) {
        this.label = label;
        this.pixels = pixels;
        Arrays.sort(this.pixels);
        this.sizeX = sizeX;
        this.sizeY = sizeY;
    }

    public int getLabel() {
        return label;
    }

    public Region setLabel(int label) {
        return new Region(label, pixels, sizeX, sizeY);
    }

    /**
     *
     * @return linear indices of the pixels, in raster scan order
     */
    public int[] getPixels() {
        return pixels;
    }

    public int size() {
        return pixels.length;
    }

    public void draw(ImageInt labelMap, int value) {
        for (int xy : pixels) labelMap.setPixel(xy, 0, value);
    }

    @Override
    public boolean insideMask(int x, int y, int z) {
        return z==0 && Arrays.binarySearch(pixels, x + y * sizeX)>=0;
    }

    @Override
    public boolean insideMask(int xy, int z) {
        return z==0 && Arrays.binarySearch(pixels, xy)>=0;
    }

    @Override
    public int count() {
        return pixels.length;
    }

    @Override public String getName() {return "region"+label;}
    @Override public int sizeX() {return sizeX;}
    @Override public int sizeY() {return sizeY;}
    @Override public int sizeZ() {return 1;}
    @Override public int sizeXY() {return sizeX*sizeY;}
    @Override public int sizeXYZ() {return sizeX*sizeY;}

    @Override
    public String toString() {
        return "Region{label="+label+", size="+pixels.length+"}";
    }
}
