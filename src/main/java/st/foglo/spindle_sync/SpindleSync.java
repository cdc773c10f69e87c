package st.foglo.spindle_sync;

// spindle-sync - aligns CNC spindle frequency timelines with audio recordings
//
// Copyright (C) 2020 Rabbe Fogelholm
//
// This program is free software: you can redistribute it and/or modify
// it under the terms of the GNU General Public License as published by
// the Free Software Foundation, either version 3 of the License, or
// (at your option) any later version.
//
// This program is distributed in the hope that it will be useful,
// but WITHOUT ANY WARRANTY; without even the implied warranty of
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
// GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public License
// along with this program.  If not, see <http://www.gnu.org/licenses/>.

import java.io.File;
import java.io.IOException;
import java.util.Locale;

import javax.sound.sampled.UnsupportedAudioFileException;

import st.foglo.spindle_sync.SyncLib.Death;
import st.foglo.spindle_sync.SyncLib.Flag;
import st.foglo.spindle_sync.SyncLib.HelpOption;
import st.foglo.spindle_sync.SyncLib.Info;
import st.foglo.spindle_sync.SyncLib.Options;
import st.foglo.spindle_sync.SyncLib.SingleValueOption;
import st.foglo.spindle_sync.SyncLib.SteppingOption;
import st.foglo.spindle_sync.SyncLib.VersionOption;
import st.foglo.spindle_sync.anchors.AnchorFile;
import st.foglo.spindle_sync.form.BendedSegmentBuilder;
import st.foglo.spindle_sync.form.FormFunctionFactory;
import st.foglo.spindle_sync.form.ReferencePoints;
import st.foglo.spindle_sync.grid.Grid;
import st.foglo.spindle_sync.grid.SliceFactory;
import st.foglo.spindle_sync.grid.ValueSliceConfig;
import st.foglo.spindle_sync.lib.Compute;
import st.foglo.spindle_sync.mask.MaskFactory;
import st.foglo.spindle_sync.optimize.RefPointOptimizer;
import st.foglo.spindle_sync.optimize.Refinement;
import st.foglo.spindle_sync.spectrum.Spectrogram;
import st.foglo.spindle_sync.spectrum.Stft;
import st.foglo.spindle_sync.wave.Decimator;
import st.foglo.spindle_sync.wave.Wav;

public final class SpindleSync {

    static final String O_VERSION = "version";
    static final String O_RAMP_UP = "ramp-up";
    static final String O_RAMP_DOWN = "ramp-down";
    static final String O_OUTPUT = "output";
    static final String O_NFFT = "fft-size";
    static final String O_WINLENGTH = "window-length";
    static final String O_HOP = "hop-length";
    static final String O_DECIMATION = "decimation";
    static final String O_TIME_WINDOW = "time-window";
    static final String O_FREQ_WINDOW = "freq-window";
    static final String O_FREQ_BUFFER = "freq-buffer";
    static final String O_RESOLUTIONS = "resolutions";
    static final String O_FREQ_SEARCH = "freq-search";
    static final String O_NO_HARMONIC = "no-harmonic";
    static final String O_VERBOSE = "verbose";

    static final String O_HIDDEN = "hidden-options";
    public enum HiddenOpts {
        UPSAMPLE,
        ORDER
    };

    /**
     * Resolutions given with -R, in this order.
     */
    public enum Pass {
        GLOBAL,
        FREQUENCY,
        TIME
    };

    /**
     * The frequency slice always includes this frequency, Hz.
     */
    static final double SLICE_PIVOT = 100.0;

    static Options createOptions() {
        final Options opts = new Options();

        new VersionOption(opts, "V", O_VERSION, "spindle-sync version 1.0.0");

        new SingleValueOption(opts, "u", O_RAMP_UP, "60.0");
        new SingleValueOption(opts, "d", O_RAMP_DOWN, "-60.0");

        new SingleValueOption(opts, "o", O_OUTPUT, "optimized_guesses.csv");

        new SingleValueOption(opts, "n", O_NFFT, "16384");
        new SingleValueOption(opts, "w", O_WINLENGTH, "8192");
        new SingleValueOption(opts, "k", O_HOP, "512");
        new SingleValueOption(opts, "m", O_DECIMATION, "1");

        new SingleValueOption(opts, "T", O_TIME_WINDOW, "5");
        new SingleValueOption(opts, "F", O_FREQ_WINDOW, "5");
        new SingleValueOption(opts, "B", O_FREQ_BUFFER, "15");

        new SingleValueOption(opts, "R", O_RESOLUTIONS, "0.2,1,1");
        new SingleValueOption(opts, "s", O_FREQ_SEARCH, "30");
        new Flag(opts, "N", O_NO_HARMONIC);

        new SteppingOption(opts, "v", O_VERBOSE);

        new SingleValueOption(opts, "H", O_HIDDEN,
                 "10"+                      // mask upsampling factor
                ",4"                        // decimation filter order
                );

        new HelpOption(opts,
                "h",
new String[]{
        "Usage is: bin/spindle-sync [OPTIONS] WAVEFILE ANCHORFILE",
        "Options are:",
        String.format("  -u SLOPE           Spindle ramp-up slope (Hz/s), defaults to %s", opts.getDefault(O_RAMP_UP)),
        String.format("  -d SLOPE           Spindle ramp-down slope (Hz/s), defaults to %s", opts.getDefault(O_RAMP_DOWN)),
        String.format("  -o FILE            Output file, defaults to %s", opts.getDefault(O_OUTPUT)),
        String.format("  -n NFFT            FFT size, defaults to %s", opts.getDefault(O_NFFT)),
        String.format("  -w LENGTH          STFT window length, defaults to %s", opts.getDefault(O_WINLENGTH)),
        String.format("  -k HOP             STFT hop length, defaults to %s", opts.getDefault(O_HOP)),
        String.format("  -m FACTOR          Decimation factor, defaults to %s", opts.getDefault(O_DECIMATION)),
        String.format("  -T CELLS           Corridor time window (time cells), defaults to %s", opts.getDefault(O_TIME_WINDOW)),
        String.format("  -F CELLS           Corridor frequency window (frequency cells), defaults to %s", opts.getDefault(O_FREQ_WINDOW)),
        String.format("  -B HZ              Frequency slice margin, defaults to %s", opts.getDefault(O_FREQ_BUFFER)),
        String.format("  -R G,F,T           Search resolutions, defaults to %s", opts.getDefault(O_RESOLUTIONS)),
        String.format("  -s HZ              Frequency search half width, defaults to %s", opts.getDefault(O_FREQ_SEARCH)),
        String.format("  -N                 Ignore the first harmonic"),
        String.format("  -H PARAMETERS      Experimental parameters, default: %s", opts.getDefault(O_HIDDEN)),
        String.format("  -v                 Verbosity (may be given several times)"),
        String.format("  -V                 Show version"),
        String.format("  -h                 This help"),
        "",
        "ANCHORFILE holds one anchor per line: time (s) and frequency (Hz),",
        "separated by a comma or whitespace. The first anchor must be at",
        "time 0 with frequency 0. A terminal anchor with frequency 0 is",
        "added at the end of the recording.",
        "",
        "The refined anchors are written as CSV to the output file."
                });

        return opts;
    }

    public static void main(String[] clArgs) {

        // Ensure that decimal points (not commas) are used
        Locale.setDefault(new Locale("en", "US"));

        try {
            final Options opts = createOptions();
            opts.parseArgs(clArgs);
            SyncLib.setVerbosity(opts.getIntOpt(O_VERBOSE));
            showClData(opts);

            if (opts.nofArguments() != 2) {
                new Death("expecting two arguments, try -h for help");
            }

            final ReferencePoints refined = run(opts);
            new Info("refined anchors: %s", refined);
        }
        catch (Exception e) {
            new Death(e);
        }
    }

    /**
     * Runs the whole chain on the files named in the arguments and writes
     * the refined anchors to the output file.
     */
    static ReferencePoints run(Options opts) throws IOException, UnsupportedAudioFileException {

        // ===================================== Recording

        final Wav w = new Wav(new File(opts.getArgument(0)));
        final double[] hidden = opts.getDoubleOptMulti(O_HIDDEN);
        final Decimator decimator = new Decimator(opts.getIntOpt(O_DECIMATION),
                (int) hidden[HiddenOpts.ORDER.ordinal()]);
        final float[] signal = decimator.decimate(w.wav, w.frameRate);
        final double sampleRate = (double) w.frameRate/decimator.getFactor();
        new Info("sample rate after decimation: %.1f", sampleRate);

        // ===================================== Spectrogram

        final Stft stft = new Stft(opts.getIntOpt(O_NFFT), opts.getIntOpt(O_WINLENGTH), opts.getIntOpt(O_HOP));
        final Spectrogram spec = Spectrogram.compute(signal, sampleRate, stft).sqrtCompressed();
        final Grid grid = spec.grid();
        new Info("grid: %s", grid);

        // ===================================== Anchors

        final ReferencePoints nominal =
                AnchorFile.withTerminal(AnchorFile.read(new File(opts.getArgument(1))), grid.timeMax);
        new Info("nominal anchors: %s", nominal);

        // ===================================== Optimizer

        final FormFunctionFactory formFactory = new FormFunctionFactory(
                new BendedSegmentBuilder(opts.getDoubleOpt(O_RAMP_UP), opts.getDoubleOpt(O_RAMP_DOWN)),
                nominal.time(nominal.size() - 1));

        final MaskFactory maskFactory = new MaskFactory(grid,
                opts.getDoubleOpt(O_TIME_WINDOW)*spec.timeDelta(),
                opts.getDoubleOpt(O_FREQ_WINDOW)*spec.freqDelta(),
                (int) hidden[HiddenOpts.UPSAMPLE.ordinal()]);

        final SliceFactory sliceFactory = new SliceFactory(grid,
                frequencySlice(nominal, opts.getDoubleOpt(O_FREQ_BUFFER)));

        final RefPointOptimizer optimizer = new RefPointOptimizer(
                formFactory,
                maskFactory,
                sliceFactory,
                spec.times(),
                spec.magnitudes,
                spec.timeDelta(),
                spec.freqDelta(),
                !opts.getFlag(O_NO_HARMONIC),
                null);

        final double[] resolutions = opts.getDoubleOptMulti(O_RESOLUTIONS);
        if (resolutions.length != Pass.values().length) {
            throw new ConfigException("option -R: expecting %d resolutions, got: %s",
                    Pass.values().length, opts.getOpt(O_RESOLUTIONS));
        }

        final Refinement refinement = new Refinement(optimizer,
                resolutions[Pass.GLOBAL.ordinal()],
                resolutions[Pass.FREQUENCY.ordinal()],
                resolutions[Pass.TIME.ordinal()],
                opts.getDoubleOpt(O_FREQ_SEARCH));

        final ReferencePoints refined = refinement.run(nominal);

        AnchorFile.write(new File(opts.getOpt(O_OUTPUT)), refined);
        return refined;
    }

    /**
     * Frequencies from just below the lowest anchor frequency up to just
     * above the first harmonic of the highest one.
     */
    static ValueSliceConfig frequencySlice(ReferencePoints points, double buffer) {
        double fMinNonZero = Double.POSITIVE_INFINITY;
        double fMax = 0.0;
        for (int i = 0; i < points.size(); i++) {
            final double f = points.frequency(i);
            if (f != 0.0) {
                fMinNonZero = Compute.dMin(fMinNonZero, f);
            }
            fMax = Compute.dMax(fMax, f);
        }
        if (fMinNonZero == Double.POSITIVE_INFINITY) {
            throw new ConfigException("no anchor with non-zero frequency");
        }
        return ValueSliceConfig.frequency(
                Compute.dMin(fMinNonZero - buffer, SLICE_PIVOT),
                Compute.dMax(2*fMax + buffer, SLICE_PIVOT));
    }

    private static void showClData(Options opts) {
        new Info("ramp slopes: %f, %f", opts.getDoubleOpt(O_RAMP_UP), opts.getDoubleOpt(O_RAMP_DOWN));
        new Info("stft: %d, %d, %d", opts.getIntOpt(O_NFFT), opts.getIntOpt(O_WINLENGTH), opts.getIntOpt(O_HOP));
        new Info("decimation: %d", opts.getIntOpt(O_DECIMATION));
        new Info("windows: %s, %s cells", opts.getOpt(O_TIME_WINDOW), opts.getOpt(O_FREQ_WINDOW));
        new Info("resolutions: %s", opts.getOpt(O_RESOLUTIONS));
        new Info("first harmonic: %b", !opts.getFlag(O_NO_HARMONIC));
        new Info("hidden: %s", opts.getOpt(O_HIDDEN));
        new Info("verbose: %d", opts.getIntOpt(O_VERBOSE));

        for (int k = 0; k < opts.nofArguments(); k++) {
            new Info("argument %d: %s", k+1, opts.getArgument(k));
        }
    }
}
