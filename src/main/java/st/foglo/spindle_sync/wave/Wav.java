package st.foglo.spindle_sync.wave;

import java.io.File;
import java.io.IOException;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

import st.foglo.spindle_sync.SyncLib.Info;

/**
 * Read a WAV file into a float[] array. Stereo is mixed down to mono,
 * values are scaled to [-1, 1).
 */
public final class Wav {

    final File file;

    public final int frameRate;          // frames/s
    public final float[] wav;            // signal values
    public final int nofFrames;          // nof. frames == length of wav

    public Wav(File file) throws IOException, UnsupportedAudioFileException {

        this.file = file;

        try (AudioInputStream ais = AudioSystem.getAudioInputStream(file)) {
            final AudioFormat af = ais.getFormat();
            new Info("audio format: %s", af.toString());

            this.frameRate = Math.round(af.getFrameRate());
            new Info("frame rate: %d", frameRate);

            final int nch = af.getChannels();
            new Info("nof. channels: %d", nch);

            final int bpf = af.getFrameSize();
            if (bpf == AudioSystem.NOT_SPECIFIED) {
                throw new UnsupportedAudioFileException("bytes per frame is NOT SPECIFIED");
            }
            else {
                new Info("bytes per frame: %d", bpf);
            }
            if (af.isBigEndian() && bpf > nch) {
                throw new UnsupportedAudioFileException("cannot handle big-endian WAV file");
            }
            if (!(bpf == 1 && nch == 1) &&
                    !(bpf == 2 && nch == 1) &&
                    !(bpf == 3 && nch == 1) &&
                    !(bpf == 4 && nch == 2) &&
                    !(bpf == 6 && nch == 2)) {
                throw new UnsupportedAudioFileException(
                        String.format("cannot handle bytesPerFrame: %d, nofChannels: %d", bpf, nch));
            }

            final byte[] b = ais.readAllBytes();
            this.nofFrames = b.length/bpf;
            new Info(".wav file length: %.1f s", (double)nofFrames/frameRate);
            new Info("nof. frames: %d", nofFrames);

            this.wav = new float[nofFrames];

            final boolean unsigned8 = af.getEncoding() == AudioFormat.Encoding.PCM_UNSIGNED;

            if (bpf == 1 && nch == 1) {
                for (int j = 0; j < nofFrames; j++) {
                    final int v = unsigned8 ? (b[j] & 0xff) - 128 : b[j];
                    wav[j] = v/128f;
                }
            }
            else if (bpf == 2 && nch == 1) {
                for (int j = 0; j < nofFrames; j++) {
                    wav[j] = sample16(b, bpf*j)/32768f;
                }
            }
            else if (bpf == 3 && nch == 1) {
                for (int j = 0; j < nofFrames; j++) {
                    wav[j] = sample24(b, bpf*j)/8388608f;
                }
            }
            else if (bpf == 4 && nch == 2) {
                for (int j = 0; j < nofFrames; j++) {
                    final int left = sample16(b, bpf*j);
                    final int right = sample16(b, bpf*j+2);
                    wav[j] = (left + right)/65536f;
                }
            }
            else {
                // 2 channels, 24 bits per channel
                for (int j = 0; j < nofFrames; j++) {
                    final int left = sample24(b, bpf*j);
                    final int right = sample24(b, bpf*j+3);
                    wav[j] = (left + right)/16777216f;
                }
            }
        }
    }

    private static int sample16(byte[] b, int k) {
        return 256*b[k+1] + (b[k] & 0xff);
    }

    private static int sample24(byte[] b, int k) {
        return 65536*b[k+2] + 256*(b[k+1] & 0xff) + (b[k] & 0xff);
    }

    /**
     * Duration in seconds.
     */
    public double duration() {
        return (double) nofFrames/frameRate;
    }
}
