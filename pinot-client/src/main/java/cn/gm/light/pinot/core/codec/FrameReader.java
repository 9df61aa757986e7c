package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.exception.ProtocolException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * 大端 int32 长度前缀格式的顺序读取
 */
class FrameReader {
    private final ByteBuffer buffer;

    FrameReader(byte[] bytes) {
        this.buffer = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
    }

    int readInt(String what) {
        try {
            return buffer.getInt();
        } catch (BufferUnderflowException e) {
            throw new ProtocolException("failed to read " + what + ": unexpected end of payload", e);
        }
    }

    /**
     * 读取非负长度
     */
    int readLength(String what) {
        int length = readInt(what);
        if (length < 0) {
            throw ProtocolException.of("invalid " + what + ": " + length);
        }
        return length;
    }

    byte[] readBytes(int length, String what) {
        if (buffer.remaining() < length) {
            throw ProtocolException.of("failed to read " + what + ": need " + length
                    + " bytes but only " + buffer.remaining() + " left");
        }
        byte[] out = new byte[length];
        buffer.get(out);
        return out;
    }

    String readString(String what) {
        int length = readLength(what + " length");
        return new String(readBytes(length, what), StandardCharsets.UTF_8);
    }
}
