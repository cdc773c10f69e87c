package st.foglo.spindle_sync.anchors;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import st.foglo.spindle_sync.ConfigException;
import st.foglo.spindle_sync.SyncLib.Info;
import st.foglo.spindle_sync.form.ReferencePoints;

/**
 * Reads nominal anchors and writes refined ones. One anchor per line,
 * time in seconds followed by frequency in Hz, separated by a comma or
 * whitespace.
 */
public final class AnchorFile {

    public static final String HEADER = "time [s],freq [Hz]";

    private AnchorFile() {
    }

    public static ReferencePoints read(File file) throws IOException {
        final List<double[]> rows = new ArrayList<double[]>();
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            int lineNo = 0;
            for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                lineNo++;
                final String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                final String[] fields = trimmed.split("[,\\s]+");
                if (rows.isEmpty() && !isNumber(fields[0])) {
                    // header
                    continue;
                }
                if (fields.length != 2) {
                    throw new ConfigException("%s:%d: expecting time and frequency, got: %s",
                            file.getName(), lineNo, trimmed);
                }
                try {
                    rows.add(new double[]{Double.parseDouble(fields[0]), Double.parseDouble(fields[1])});
                }
                catch (NumberFormatException e) {
                    throw new ConfigException("%s:%d: not a number: %s", file.getName(), lineNo, trimmed);
                }
            }
        }

        final double[] times = new double[rows.size()];
        final double[] freqs = new double[rows.size()];
        for (int i = 0; i < times.length; i++) {
            times[i] = rows.get(i)[0];
            freqs[i] = rows.get(i)[1];
        }
        new Info("read %d anchors from: %s", times.length, file.getPath());
        return new ReferencePoints(times, freqs);
    }

    /**
     * Appends the terminal anchor, at frequency 0, no earlier than the end
     * of the recording and at least 1 s after the last anchor.
     */
    public static ReferencePoints withTerminal(ReferencePoints points, double recordingEnd) {
        if (points.size() == 0) {
            throw new ConfigException("no anchors given");
        }
        boolean allZero = true;
        for (int i = 0; i < points.size(); i++) {
            allZero &= points.time(i) == 0.0;
        }
        if (allZero) {
            throw new ConfigException("all anchor times are zero, cannot continue");
        }

        final int n = points.size();
        final double[] times = new double[n + 1];
        final double[] freqs = new double[n + 1];
        System.arraycopy(points.getTimes(), 0, times, 0, n);
        System.arraycopy(points.getFreqs(), 0, freqs, 0, n);
        times[n] = Math.max(points.time(n - 1) + 1, recordingEnd);
        freqs[n] = 0.0;
        return new ReferencePoints(times, freqs);
    }

    public static void write(File file, ReferencePoints points) throws IOException {
        try (PrintWriter w = new PrintWriter(Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8))) {
            w.println(HEADER);
            for (int i = 0; i < points.size(); i++) {
                w.println(points.time(i) + "," + points.frequency(i));
            }
            if (w.checkError()) {
                throw new IOException("failed to write: " + file.getPath());
            }
        }
        new Info("wrote %d anchors to: %s", points.size(), file.getPath());
    }

    private static boolean isNumber(String s) {
        try {
            Double.parseDouble(s);
            return true;
        }
        catch (NumberFormatException e) {
            return false;
        }
    }
}
