package org.cardiocore.signal.spectral;

/**
 * Welch power spectral density over Hann-windowed, half-overlapping segments.
 * Segments are mean-detrended and zero-padded to a power of two for the FFT.
 */
public final class SpectralAnalysis {

    private SpectralAnalysis() {
    }

    public static PowerSpectrum welch(double[] x, double sampleRate, int segmentLength) {
        int n = x.length;
        int nperseg = Math.max(1, Math.min(segmentLength, n));
        int nfft = nextPowerOfTwo(nperseg);
        int step = Math.max(1, nperseg / 2);

        double[] window = hann(nperseg);
        double windowPower = 0.0;
        for (double w : window) {
            windowPower += w * w;
        }

        int bins = nfft / 2 + 1;
        double[] psd = new double[bins];
        int segments = 0;
        for (int start = 0; start + nperseg <= n; start += step) {
            double mean = 0.0;
            for (int i = 0; i < nperseg; i++) {
                mean += x[start + i];
            }
            mean /= nperseg;

            double[] re = new double[nfft];
            double[] im = new double[nfft];
            for (int i = 0; i < nperseg; i++) {
                re[i] = (x[start + i] - mean) * window[i];
            }
            fft(re, im);
            for (int k = 0; k < bins; k++) {
                psd[k] += re[k] * re[k] + im[k] * im[k];
            }
            segments++;
        }

        double scale = segments > 0 && windowPower > 0 ? 1.0 / (sampleRate * windowPower * segments) : 0.0;
        double[] frequencies = new double[bins];
        for (int k = 0; k < bins; k++) {
            psd[k] *= scale;
            // one-sided: fold negative frequencies except DC and Nyquist
            if (k > 0 && k < nfft / 2) {
                psd[k] *= 2;
            }
            frequencies[k] = k * sampleRate / nfft;
        }
        return new PowerSpectrum(frequencies, psd);
    }

    static double[] hann(int length) {
        double[] w = new double[length];
        if (length == 1) {
            w[0] = 1.0;
            return w;
        }
        // periodic Hann, as used for spectral estimation
        for (int i = 0; i < length; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2 * Math.PI * i / length);
        }
        return w;
    }

    static int nextPowerOfTwo(int n) {
        int p = 1;
        while (p < n) {
            p <<= 1;
        }
        return p;
    }

    /**
     * In-place iterative radix-2 FFT; length must be a power of two
     */
    static void fft(double[] re, double[] im) {
        int n = re.length;
        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i]; re[i] = re[j]; re[j] = t;
                t = im[i]; im[i] = im[j]; im[j] = t;
            }
        }
        for (int len = 2; len <= n; len <<= 1) {
            double angle = -2 * Math.PI / len;
            double wRe = Math.cos(angle);
            double wIm = Math.sin(angle);
            for (int i = 0; i < n; i += len) {
                double curRe = 1.0;
                double curIm = 0.0;
                for (int k = 0; k < len / 2; k++) {
                    int a = i + k;
                    int b = i + k + len / 2;
                    double tRe = re[b] * curRe - im[b] * curIm;
                    double tIm = re[b] * curIm + im[b] * curRe;
                    re[b] = re[a] - tRe;
                    im[b] = im[a] - tIm;
                    re[a] += tRe;
                    im[a] += tIm;
                    double nextRe = curRe * wRe - curIm * wIm;
                    curIm = curRe * wIm + curIm * wRe;
                    curRe = nextRe;
                }
            }
        }
    }
}
