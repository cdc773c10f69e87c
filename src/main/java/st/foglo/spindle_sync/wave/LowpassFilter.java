package st.foglo.spindle_sync.wave;

public interface LowpassFilter {

    double filter(double in);
}
