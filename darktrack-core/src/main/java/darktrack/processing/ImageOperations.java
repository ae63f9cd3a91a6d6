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
package darktrack.processing;

import darktrack.image.Image;
import darktrack.image.ImageFloat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pixel-wise operations and projections on float images
 * @author Jean Ollion
 */
public class ImageOperations {
    public final static Logger logger = LoggerFactory.getLogger(ImageOperations.class);

    /**
     * Zero-padding of a 2D image
     * @param image 2D image
     * @param border number of pixels added on each side
     * @return padded image of size (sizeX + 2 * border) x (sizeY + 2 * border)
     */
    public static ImageFloat pad(Image image, int border) {
        if (image.sizeZ()!=1) throw new IllegalArgumentException("Only 2D images can be padded");
        int sX = image.sizeX()+2*border;
        ImageFloat res = new ImageFloat(image.getName()+"_padded", sX, image.sizeY()+2*border, 1);
        float[] out = res.getPixelArray()[0];
        for (int y = 0; y<image.sizeY(); ++y) {
            int off = (y+border) * sX + border;
            for (int x = 0; x<image.sizeX(); ++x) out[off + x] = image.getPixel(x, y, 0);
        }
        return res;
    }

    /**
     * 
     * @param image 2D image
     * @param border number of pixels removed on each side
     * @return central part of {@param image}
     */
    public static ImageFloat crop(ImageFloat image, int border) {
        int sX = image.sizeX()-2*border;
        int sY = image.sizeY()-2*border;
        if (sX<=0 || sY<=0) throw new IllegalArgumentException("Border too large for image: "+image);
        float[] in = image.getPixelArray()[0];
        float[] out = new float[sX*sY];
        for (int y = 0; y<sY; ++y) System.arraycopy(in, (y+border)*image.sizeX()+border, out, y*sX, sX);
        return new ImageFloat(image.getName(), sX, out);
    }

    /**
     * 
     * @return new image: {@param image1} - {@param image2}
     */
    public static ImageFloat subtract(ImageFloat image1, ImageFloat image2, String name) {
        if (!image1.sameDimensions(image2)) throw new IllegalArgumentException("Subtract: images should have same dimensions: "+image1+" vs "+image2);
        ImageFloat res = new ImageFloat(name, image1);
        float[][] p1 = image1.getPixelArray();
        float[][] p2 = image2.getPixelArray();
        float[][] out = res.getPixelArray();
        for (int z = 0; z<image1.sizeZ(); ++z) {
            for (int xy = 0; xy<image1.sizeXY(); ++xy) out[z][xy] = p1[z][xy] - p2[z][xy];
        }
        return res;
    }

    /**
     * Pixel-wise product, in place in {@param image1}
     * @return {@param image1}
     */
    public static ImageFloat multiply(ImageFloat image1, ImageFloat image2) {
        if (!image1.sameDimensions(image2)) throw new IllegalArgumentException("Multiply: images should have same dimensions: "+image1+" vs "+image2);
        float[][] p1 = image1.getPixelArray();
        float[][] p2 = image2.getPixelArray();
        for (int z = 0; z<image1.sizeZ(); ++z) {
            for (int xy = 0; xy<image1.sizeXY(); ++xy) p1[z][xy] *= p2[z][xy];
        }
        return image1;
    }

    /**
     * 
     * @param stack 3D image
     * @param planeCount number of planes averaged, starting from plane 0
     * @return 2D image: mean of the first {@param planeCount} planes
     */
    public static ImageFloat meanZProjection(ImageFloat stack, int planeCount) {
        if (planeCount<1 || planeCount>stack.sizeZ()) throw new IllegalArgumentException("Invalid plane count: "+planeCount+" for image: "+stack);
        double[] sum = new double[stack.sizeXY()];
        float[][] p = stack.getPixelArray();
        for (int z = 0; z<planeCount; ++z) {
            for (int xy = 0; xy<sum.length; ++xy) sum[xy]+=p[z][xy];
        }
        float[] out = new float[sum.length];
        for (int xy = 0; xy<sum.length; ++xy) out[xy] = (float)(sum[xy]/planeCount);
        return new ImageFloat("mean", stack.sizeX(), out);
    }

    public static ImageFloat maxZProjection(ImageFloat stack) {
        float[][] p = stack.getPixelArray();
        float[] out = new float[stack.sizeXY()];
        System.arraycopy(p[0], 0, out, 0, out.length);
        for (int z = 1; z<stack.sizeZ(); ++z) {
            for (int xy = 0; xy<out.length; ++xy) if (p[z][xy]>out[xy]) out[xy] = p[z][xy];
        }
        return new ImageFloat(stack.getName()+"_max", stack.sizeX(), out);
    }

    /**
     * 
     * @param stack 3D image
     * @return for each pixel, the plane index of the maximal value along Z (first plane in case of ties)
     */
    public static int[] argMaxZProjection(ImageFloat stack) {
        float[][] p = stack.getPixelArray();
        int[] res = new int[stack.sizeXY()];
        for (int xy = 0; xy<res.length; ++xy) {
            float max = p[0][xy];
            for (int z = 1; z<stack.sizeZ(); ++z) {
                if (p[z][xy]>max) {
                    max = p[z][xy];
                    res[xy] = z;
                }
            }
        }
        return res;
    }

    /**
     * Linear scaling of values to [0;1], in place. An image with a single value is set to 0.
     * @return {@param image}
     */
    public static ImageFloat normalize(ImageFloat image) {
        double[] mm = image.getMinAndMax(null);
        double range = mm[1] - mm[0];
        float[][] p = image.getPixelArray();
        for (int z = 0; z<image.sizeZ(); ++z) {
            for (int xy = 0; xy<image.sizeXY(); ++xy) p[z][xy] = range>0 ? (float)((p[z][xy]-mm[0])/range) : 0;
        }
        return image;
    }
}
