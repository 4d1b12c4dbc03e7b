package io.edgeseq.sequence;

/**
 * Invalid option, or options that contradict the state a previous run left behind.
 */
public class ConfigurationException extends EdgeSequenceException {
    public ConfigurationException(String message) {
        super(message);
    }
}
