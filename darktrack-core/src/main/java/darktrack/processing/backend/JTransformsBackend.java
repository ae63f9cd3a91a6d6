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
import org.jtransforms.fft.DoubleFFT_2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Default backend, on the CPU, based on JTransforms' mixed-radix FFT (arbitrary sizes)
 * @author Jean Ollion
 */
public class JTransformsBackend implements NumericBackend {
    public final static Logger logger = LoggerFactory.getLogger(JTransformsBackend.class);
    public final static String NAME = "JTransforms";
    // FFT plans hold work buffers: one set per thread
    private final ThreadLocal<Map<Long, DoubleFFT_2D>> plans = ThreadLocal.withInitial(HashMap::new);

    @Override
    public String getName() {
        return NAME;
    }

    protected DoubleFFT_2D getPlan(int sizeX, int sizeY) {
        long key = ((long)sizeY<<32) | sizeX;
        return plans.get().computeIfAbsent(key, k -> new DoubleFFT_2D(sizeY, sizeX));
    }

    @Override
    public ComplexField forwardTransform(ImageFloat image) {
        ComplexField res = ComplexField.fromReal(image);
        getPlan(res.sizeX, res.sizeY).complexForward(res.data);
        return res;
    }

    @Override
    public ComplexField forwardTransform(ComplexField field) {
        ComplexField res = field.duplicate();
        getPlan(res.sizeX, res.sizeY).complexForward(res.data);
        return res;
    }

    @Override
    public void inverseTransform(ComplexField spectrum) {
        getPlan(spectrum.sizeX, spectrum.sizeY).complexInverse(spectrum.data, true);
    }

    @Override
    public ComplexField applyTransferFunction(ComplexField spectrum, FrequencyKernel kernel, double z) {
        if (kernel.sizeX()!=spectrum.sizeX || kernel.sizeY()!=spectrum.sizeY) throw new IllegalArgumentException("Kernel and spectrum dimensions differ");
        double[] in = spectrum.data;
        double[] out = new double[in.length];
        double twoPiZ = 2 * Math.PI * z;
        int n = spectrum.sizeX * spectrum.sizeY;
        for (int i = 0; i<n; ++i) {
            double phase = twoPiZ * kernel.get(i);
            double c = Math.cos(phase);
            double s = Math.sin(phase);
            double re = in[2*i];
            double im = in[2*i+1];
            out[2*i] = re * c - im * s;
            out[2*i+1] = re * s + im * c;
        }
        return new ComplexField(spectrum.sizeX, spectrum.sizeY, out);
    }

    @Override
    public float[] modulus(ComplexField field, int border) {
        int sX = field.sizeX - 2*border;
        int sY = field.sizeY - 2*border;
        if (sX<=0 || sY<=0) throw new IllegalArgumentException("Border too large for field: "+field.sizeX+"x"+field.sizeY);
        float[] res = new float[sX*sY];
        double[] d = field.data;
        for (int y = 0; y<sY; ++y) {
            int off = 2*((y+border)*field.sizeX + border);
            for (int x = 0; x<sX; ++x) {
                double re = d[off + 2*x];
                double im = d[off + 2*x + 1];
                res[x + y*sX] = (float)Math.sqrt(re*re + im*im);
            }
        }
        return res;
    }
}
