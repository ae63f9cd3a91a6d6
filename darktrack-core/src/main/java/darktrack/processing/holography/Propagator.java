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
package darktrack.processing.holography;

import darktrack.processing.backend.ComplexField;
import darktrack.processing.backend.NumericBackend;

/**
 * Angular-spectrum propagation: u(z) = IFFT(FFT(u) · exp(i·2π·z·FZ)).
 * The kernel is computed once and reused for every distance.
 * @author Jean Ollion
 */
public class Propagator {
    final FrequencyKernel kernel;
    final NumericBackend backend;

    public Propagator(FrequencyKernel kernel, NumericBackend backend) {
        this.kernel = kernel;
        this.backend = backend;
    }

    public FrequencyKernel getKernel() {
        return kernel;
    }

    public NumericBackend getBackend() {
        return backend;
    }

    /**
     * 
     * @param spectrum Fourier transform of the field in the reference plane, not modified
     * @param z distance, positive or negative
     * @return complex field at distance {@param z}
     */
    public ComplexField propagate(ComplexField spectrum, double z) {
        ComplexField res = backend.applyTransferFunction(spectrum, kernel, z);
        backend.inverseTransform(res);
        return res;
    }

    /**
     * 
     * @param spectrum Fourier transform of the padded field in the reference plane
     * @param z distance
     * @param border padding removed from the result
     * @return amplitude of the field at distance {@param z}, without padding
     */
    public float[] propagateAmplitude(ComplexField spectrum, double z, int border) {
        return backend.modulus(propagate(spectrum, z), border);
    }

    /**
     * 
     * @param field spatial field, not modified
     * @param z distance
     * @return spatial field at distance {@param z}
     */
    public ComplexField propagateField(ComplexField field, double z) {
        return propagate(backend.forwardTransform(field), z);
    }
}
