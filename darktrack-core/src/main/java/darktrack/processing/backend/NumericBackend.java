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
import darktrack.processing.holography.FrequencyKernel;

/**
 * Numeric operations used by angular-spectrum propagation. All implementations share the same contract
 * and must give the same results within floating-point tolerance. Implementations must be safe to call from several threads.
 * Spectra are in unshifted layout: zero frequency at index (0, 0).
 * @author Jean Ollion
 */
public interface NumericBackend {
    String getName();

    /**
     * 
     * @param image 2D real image
     * @return its discrete Fourier transform
     */
    ComplexField forwardTransform(ImageFloat image);

    /**
     * 
     * @param field spatial field, not modified
     * @return its discrete Fourier transform
     */
    ComplexField forwardTransform(ComplexField field);

    /**
     * Inverse discrete Fourier transform, in place, scaled by 1/(sizeX*sizeY)
     * @param spectrum transformed field
     */
    void inverseTransform(ComplexField spectrum);

    /**
     * 
     * @param spectrum not modified
     * @param kernel axial frequencies, same dimensions as {@param spectrum}
     * @param z propagation distance, same unit as the kernel wavelength
     * @return new spectrum: spectrum · exp(i·2π·z·FZ)
     */
    ComplexField applyTransferFunction(ComplexField spectrum, FrequencyKernel kernel, double z);

    /**
     * 
     * @param field complex field
     * @param border number of pixels removed on each side
     * @return modulus of the central part of {@param field}, indexed x + y * (sizeX - 2 * border)
     */
    float[] modulus(ComplexField field, int border);
}
