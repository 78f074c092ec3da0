package hle.remote.client.grpc;

import hle.remote.codec.PayloadCodec;
import hle.remote.codec.PayloadCodecException;
import io.grpc.MethodDescriptor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * gRPC marshaller carrying one value per message as UTF-8 JSON. A message decoding
 * to JSON {@code null} is rejected: gRPC has no null messages.
 *
 * @param <T> the message type
 */
public class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    private final PayloadCodec codec;
    private final Class<T> type;

    public JsonMarshaller(PayloadCodec codec, Class<T> type) {
        this.codec = codec;
        this.type = type;
    }

    @Override
    public InputStream stream(T value) {
        return new ByteArrayInputStream(codec.encode(value));
    }

    @Override
    public T parse(InputStream stream) {
        T value;
        try {
            value = codec.decode(stream.readAllBytes(), type);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to read " + type.getSimpleName() + " message", e);
        }
        if (value == null) {
            throw new PayloadCodecException("Received a null " + type.getSimpleName() + " message", null);
        }
        return value;
    }
}
