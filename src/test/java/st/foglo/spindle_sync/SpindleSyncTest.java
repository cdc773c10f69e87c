package st.foglo.spindle_sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import st.foglo.spindle_sync.SyncLib.Options;
import st.foglo.spindle_sync.form.ReferencePoints;
import st.foglo.spindle_sync.grid.ValueSliceConfig;

class SpindleSyncTest {

    private static final int RATE = 8000;

    @TempDir
    Path dir;

    @Test
    void frequencySliceReachesTheFirstHarmonic() {
        final ReferencePoints p = new ReferencePoints(new double[]{0, 1, 2, 5}, new double[]{0, 200, 300, 0});
        final ValueSliceConfig c = SpindleSync.frequencySlice(p, 15.0);
        assertThat(c.fromY).isEqualTo(100.0);
        assertThat(c.toY).isEqualTo(615.0);
        assertThat(c.fromX).isNull();
        assertThat(c.toX).isNull();
    }

    @Test
    void frequencySliceStartsBelowHighAnchors() {
        final ReferencePoints p = new ReferencePoints(new double[]{0, 1, 5}, new double[]{0, 1000, 0});
        final ValueSliceConfig c = SpindleSync.frequencySlice(p, 15.0);
        assertThat(c.fromY).isEqualTo(100.0);
        assertThat(c.toY).isEqualTo(2015.0);
    }

    @Test
    void frequencySliceNeedsARunningSpindle() {
        final ReferencePoints p = new ReferencePoints(new double[]{0, 1, 5}, new double[]{0, 0, 0});
        assertThatThrownBy(() -> SpindleSync.frequencySlice(p, 15.0))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("non-zero frequency");
    }

    @Test
    void resolutionsMustBeThree() throws Exception {
        final Options opts = SpindleSync.createOptions();
        opts.parseArgs(new String[]{"-R", "1,1",
                recording().getPath(), anchors("0,0\n0.9,0\n3.9,400\n").getPath()});
        assertThatThrownBy(() -> SpindleSync.run(opts))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("-R");
    }

    /**
     * A 400 Hz tone between 1 s and 4 s. The nominal anchors are 0.1 s
     * early; refinement moves the end of the plateau to where the tone
     * stops.
     */
    @Test
    void refinesAnchorsOfASyntheticRecording() throws Exception {
        final File out = dir.resolve("refined.csv").toFile();
        final Options opts = SpindleSync.createOptions();
        opts.parseArgs(new String[]{
                "-n", "1024", "-w", "1024", "-k", "256",
                "-u", "10000", "-d", "-10000",
                "-o", out.getPath(),
                recording().getPath(),
                anchors("time [s],freq [Hz]\n0,0\n0.9,0\n3.9,400\n").getPath()});

        final ReferencePoints refined = SpindleSync.run(opts);

        assertThat(refined.size()).isEqualTo(4);
        assertThat(refined.time(0)).isEqualTo(0.0);
        assertThat(refined.frequency(0)).isEqualTo(0.0);
        assertThat(refined.frequency(1)).isEqualTo(0.0);
        assertThat(refined.time(1)).isLessThanOrEqualTo(1.2);
        assertThat(refined.time(2)).isCloseTo(4.0, within(0.2));
        assertThat(refined.frequency(2)).isCloseTo(400.0, within(15.0));
        assertThat(refined.time(3)).isCloseTo(187*256.0/RATE, within(1e-9));
        assertThat(refined.frequency(3)).isEqualTo(0.0);

        assertThat(Files.readAllLines(out.toPath())).hasSize(5).first().isEqualTo("time [s],freq [Hz]");
    }

    private File recording() throws Exception {
        final int n = 6*RATE;
        final byte[] b = new byte[2*n];
        for (int j = 0; j < n; j++) {
            final double t = (double) j/RATE;
            final int v = t >= 1.0 && t < 4.0 ? (int) Math.round(16384*Math.sin(2*Math.PI*400*t)) : 0;
            b[2*j] = (byte) v;
            b[2*j+1] = (byte) (v >> 8);
        }
        final File f = dir.resolve("recording.wav").toFile();
        if (!f.exists()) {
            final AudioFormat af = new AudioFormat(RATE, 16, 1, true, false);
            try (AudioInputStream ais = new AudioInputStream(new ByteArrayInputStream(b), af, n)) {
                AudioSystem.write(ais, AudioFileFormat.Type.WAVE, f);
            }
        }
        return f;
    }

    private File anchors(String content) throws Exception {
        final Path p = dir.resolve("anchors.csv");
        Files.writeString(p, content);
        return p.toFile();
    }
}
