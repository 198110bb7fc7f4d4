package ac.tiercache;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.redisson.client.codec.Codec;
import org.redisson.codec.Kryo5Codec;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ValueSerializer} backed by a Redisson {@link Codec}'s value encoder and decoder.
 * Defaults to {@link Kryo5Codec}.
 */
public class CodecValueSerializer implements ValueSerializer {
    private final Codec codec;

    public CodecValueSerializer() {
        this(new Kryo5Codec());
    }

    public CodecValueSerializer(Codec codec) {
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
    }

    @Override
    public byte[] serialize(Object value) throws IOException {
        ByteBuf buf = codec.getValueEncoder().encode(value);
        try {
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    @Override
    public Object deserialize(byte[] bytes) throws IOException {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        try {
            return codec.getValueDecoder().decode(buf, null);
        } finally {
            buf.release();
        }
    }

    public Codec getCodec() {
        return codec;
    }
}
