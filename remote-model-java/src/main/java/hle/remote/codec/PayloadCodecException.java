package hle.remote.codec;

import hle.remote.client.RemoteClientException;

/**
 * Thrown when a value cannot be encoded, or a payload cannot be decoded to the expected type.
 */
public class PayloadCodecException extends RemoteClientException {

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
