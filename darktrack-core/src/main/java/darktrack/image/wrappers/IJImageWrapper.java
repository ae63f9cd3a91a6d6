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
package darktrack.image.wrappers;

import darktrack.image.Image;
import darktrack.image.ImageByte;
import darktrack.image.ImageFloat;
import darktrack.image.ImageInt;
import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.ImageProcessor;

/**
 *
 * @author Jean Ollion
 */
public class IJImageWrapper {

    /**
     * Converts all planes of {@param img} (slices, frames and channels, in stack order) to a float image.
     * 32-bit pixel arrays are shared, other bit depths are converted.
     * @param img ImageJ image
     * @return float image whose Z axis is the ImageJ stack axis
     */
    public static ImageFloat wrap(ImagePlus img) {
        int slices = img.getStackSize();
        float[][] pix32 = new float[slices][];
        ImageStack stack = img.getImageStack();
        for (int i = 0; i < slices; ++i) {
            ImageProcessor ip = stack!=null ? stack.getProcessor(i + 1) : img.getProcessor();
            if (img.getBitDepth()==32) pix32[i] = (float[]) ip.getPixels();
            else pix32[i] = (float[]) ip.convertToFloatProcessor().getPixels();
        }
        return new ImageFloat(img.getTitle(), img.getWidth(), pix32);
    }

    /**
     * Generate ImageJ's ImagePlus object from {@param image}, if the type is byte or float, the pixel array is backed in the ImagePlus object, if not a conversion occurs and there is no more link between pixels arrays in ImagePlus object and Image object.
     * @param image input image
     * @param pixelSize physical size of a pixel in micrometers, ignored if &lt;=0
     * @return ImageJ's ImagePlus object, containing and ImageStack 
     */
    public static ImagePlus getImagePlus(Image image, double pixelSize) {
        ImageStack st = new ImageStack(image.sizeX(), image.sizeY(), image.sizeZ());
        if (image instanceof ImageByte) {
            byte[][] pixels = ((ImageByte)image).getPixelArray();
            for (int z = 0; z < image.sizeZ(); ++z) st.setPixels(pixels[z], z + 1);
        } else if (image instanceof ImageFloat) {
            float[][] pixels = ((ImageFloat)image).getPixelArray();
            for (int z = 0; z < image.sizeZ(); ++z) st.setPixels(pixels[z], z + 1);
        } else if (image instanceof ImageInt) {
            int[][] pixels = ((ImageInt)image).getPixelArray();
            for (int z = 0; z < image.sizeZ(); ++z) {
                float[] p = new float[pixels[z].length];
                for (int i = 0; i<p.length; ++i) p[i] = pixels[z][i];
                st.setPixels(p, z + 1);
            }
        } else {
            throw new IllegalArgumentException("Image Type cannot be converted to IJ type: "+image.getClass());
        }
        ImagePlus ip= new ImagePlus(image.getName(), st);
        if (pixelSize>0) {
            Calibration cal = new Calibration();
            cal.pixelWidth=pixelSize;
            cal.pixelHeight=pixelSize;
            cal.setUnit("um");
            ip.setCalibration(cal);
        }
        return ip;
    }

    public static ImagePlus getImagePlus(Image image) {
        return getImagePlus(image, 0);
    }
}
