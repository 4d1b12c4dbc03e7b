package io.edgeseq.sequence.window;

/** How the global normalisation bound for the temporal proxy column is chosen. */
public enum TemporalKeyMode {
    /** FIXED when a value is configured, else OBSERVED when the scan saw a txId, else SAMPLED. */
    AUTO,
    /** The configured value, as is. */
    FIXED,
    /** Largest txId routed during the scan, times the safety margin. */
    OBSERVED,
    /** Largest txId in the first N inbound spools, times the safety margin. */
    SAMPLED
}
