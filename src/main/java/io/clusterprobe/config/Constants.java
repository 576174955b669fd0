package io.clusterprobe.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_BIND_PORT = 8080;
    public static final long DEFAULT_TIMEOUT_SECONDS = 10800L;
    public static final long DEFAULT_GRACE_PERIOD_SECONDS = 60L;
    public static final long DEFAULT_ANNOTATION_INTERVAL_SECONDS = 5L;
    public static final double DEFAULT_JITTER_FACTOR = 1.2;
    public static final String DEFAULT_NAMESPACE = "cluster-probe";
    public static final String DEFAULT_OUTPUT_DIR = "/tmp/cluster-probe";
    public static final String DEFAULT_STATUS_TARGET = "cluster-probe";

    // Environment variables
    public static final String ENV_CONFIG_FILE = "PROBE_CONFIG_FILE";
    public static final String ENV_HOSTNAME = "HOSTNAME";
    public static final String ENV_POD_IP = "POD_IP";

    // Result loci
    public static final String GLOBAL_LOCUS = "global";

    // Transport
    public static final String RESULTS_PATH = "/api/v1/results";
    public static final String METHOD_POST = "POST";
    public static final String METHOD_PUT = "PUT";
    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final int MAX_SUBMISSION_BYTES = 64 * 1024 * 1024;
    public static final long TRANSPORT_DRAIN_SECONDS = 5L;

    // Status annotation
    public static final String STATUS_ANNOTATION_KEY = "cluster-probe.io/status";

    // Result storage layout under the output directory
    public static final String PATH_PLUGINS = "plugins";
    public static final String PATH_RESULTS = "results";
    public static final String SUFFIX_JSON = ".json";

    // Certificate authority
    public static final String CA_SUBJECT = "cluster-probe-ca";
    public static final String KEY_ALGORITHM = "EC";
    public static final String KEY_CURVE = "secp256r1";
    public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    public static final long CERTIFICATE_VALIDITY_HOURS = 48L;
    public static final long CERTIFICATE_BACKDATE_MINUTES = 60L;
}
