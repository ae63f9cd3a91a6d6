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
package darktrack.processing.backend;

import darktrack.image.ImageFloat;

/**
 * 2D complex field stored as interleaved real and imaginary parts in row-major order:
 * element (x, y) is at index 2 * (x + y * sizeX).
 * @author Jean Ollion
 */
public class ComplexField {
    final int sizeX, sizeY;
    final double[] data;

    public ComplexField(int sizeX, int sizeY) {
        this(sizeX, sizeY, new double[2*sizeX*sizeY]);
    }

    public ComplexField(int sizeX, int sizeY, double[] data) {
        if (data.length!=2*sizeX*sizeY) throw new IllegalArgumentException("Data length: "+data.length+" should be "+(2*sizeX*sizeY));
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.data = data;
    }

    /**
     * 
     * @param image 2D image, used as real part
     * @return complex field with null imaginary part
     */
    public static ComplexField fromReal(ImageFloat image) {
        if (image.sizeZ()!=1) throw new IllegalArgumentException("Only 2D images are supported");
        float[] p = image.getPixelArray()[0];
        ComplexField res = new ComplexField(image.sizeX(), image.sizeY());
        for (int i = 0; i<p.length; ++i) res.data[2*i] = p[i];
        return res;
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    /**
     * 
     * @return backing interleaved array
     */
    public double[] getData() {
        return data;
    }

    public double getReal(int x, int y) {
        return data[2*(x + y*sizeX)];
    }

    public double getImaginary(int x, int y) {
        return data[2*(x + y*sizeX)+1];
    }

    public void set(int x, int y, double real, double imaginary) {
        int i = 2*(x + y*sizeX);
        data[i] = real;
        data[i+1] = imaginary;
    }

    public double getModulus(int x, int y) {
        int i = 2*(x + y*sizeX);
        return Math.sqrt(data[i]*data[i] + data[i+1]*data[i+1]);
    }

    public ComplexField duplicate() {
        return new ComplexField(sizeX, sizeY, data.clone());
    }
}
