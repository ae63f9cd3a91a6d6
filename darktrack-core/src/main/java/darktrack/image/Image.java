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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;


public abstract class Image<I extends Image<I>> extends SimpleImageProperties implements ImageMask {
    public final static Logger logger = LoggerFactory.getLogger(Image.class);

    protected Image(String name, int sizeX, int sizeY, int sizeZ) {
        super(name, sizeX, sizeY, sizeZ);
    }

    protected Image(String name, ImageProperties properties) {
        super(name, properties.sizeX(), properties.sizeY(), properties.sizeZ());
    }

    public I setName(String name) {
        this.name=name;
        return (I)this;
    }

    public abstract I getZPlane(int idxZ);
    public abstract float getPixel(int x, int y, int z);
    public abstract float getPixel(int xy, int z);
    public abstract void setPixel(int x, int y, int z, double value);
    public abstract void setPixel(int xy, int z, double value);
    public abstract Object[] getPixelArray();
    public abstract I duplicate(String name);
    public I duplicate() {
        return duplicate(name);
    }
    public abstract I newImage(String name, ImageProperties properties);

    @Override
    public boolean insideMask(int x, int y, int z) {
        return getPixel(x, y, z)!=0;
    }
    @Override
    public boolean insideMask(int xy, int z) {
        return getPixel(xy, z)!=0;
    }
    @Override
    public int count() {
        int count = 0;
        for (int z = 0; z< sizeZ; ++z) {
            for (int xy=0; xy<sizeXY; ++xy) {
                if (getPixel(xy, z)!=0) ++count;
            }
        }
        return count;
    }

    /**
     *
     * @param mask if null, all pixels are considered
     * @return minimum and maximum values within {@param mask}, [NaN, NaN] if the mask is empty
     */
    public double[] getMinAndMax(ImageMask mask) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int z = 0; z < sizeZ; z++) {
            for (int xy = 0; xy < sizeXY; ++xy) {
                if (mask == null || mask.insideMask(xy, z)) {
                    double v = getPixel(xy, z);
                    if (v > max) max = v;
                    if (v < min) min = v;
                }
            }
        }
        if (min==Double.POSITIVE_INFINITY) return new double[]{Double.NaN, Double.NaN};
        return new double[]{min, max};
    }

    public static <T extends Image<T>> T mergeZPlanes(T... planes) {
        return mergeZPlanes(Arrays.asList(planes));
    }
    /**
     * Stacks 2D planes along Z. Pixel arrays are shared with the planes, not copied.
     * @param planes 2D images of same dimensions
     * @return 3D image, or null if {@param planes} is empty
     */
    public static <T extends Image<T>> T mergeZPlanes(List<T> planes) {
        if (planes==null || planes.isEmpty()) return null;
        T plane0 = planes.get(0);
        for (T p : planes) {
            if (p.sizeZ()!=1 || !p.sameDimensions2D(plane0)) throw new IllegalArgumentException("Merge Z planes: planes should be 2D and of same dimensions");
        }
        String title = "merged planes";
        if (plane0 instanceof ImageFloat) {
            float[][] pixels = new float[planes.size()][];
            for (int i = 0; i<pixels.length; ++i) pixels[i]=((float[][])planes.get(i).getPixelArray())[0];
            return (T)new ImageFloat(title, plane0.sizeX(), pixels);
        } else if (plane0 instanceof ImageInt) {
            int[][] pixels = new int[planes.size()][];
            for (int i = 0; i<pixels.length; ++i) pixels[i]=((int[][])planes.get(i).getPixelArray())[0];
            return (T)new ImageInt(title, plane0.sizeX(), pixels);
        } else if (plane0 instanceof ImageByte) {
            byte[][] pixels = new byte[planes.size()][];
            for (int i = 0; i<pixels.length; ++i) pixels[i]=((byte[][])planes.get(i).getPixelArray())[0];
            return (T)new ImageByte(title, plane0.sizeX(), pixels);
        } else throw new IllegalArgumentException("Unsupported image type: "+plane0.getClass().getSimpleName());
    }
}
