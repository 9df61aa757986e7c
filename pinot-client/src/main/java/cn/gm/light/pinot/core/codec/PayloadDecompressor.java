package cn.gm.light.pinot.core.codec;

import cn.gm.light.pinot.exception.ProtocolException;
import com.github.luben.zstd.ZstdInputStream;
import com.google.common.io.ByteStreams;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4FrameInputStream;
import org.xerial.snappy.Snappy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * gRPC 数据块解压。
 *
 * <p>LZ4 与 ZSTD 先按标准 frame 格式解，失败后再按 "4 字节大端原始长度 + 压缩数据" 的格式解；
 * 后一种格式中 LZ4 为裸 block，ZSTD 仍为 frame。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/6 10:15:48
 */
public final class PayloadDecompressor {
    private static final int LENGTH_PREFIX_BYTES = 4;
    private static final long MAX_PAYLOAD_LENGTH = Integer.MAX_VALUE - 8;
    // 单个字节可展开的最大倍数
    private static final long LZ4_MAX_RATIO = 255;
    private static final long SNAPPY_MAX_RATIO = 32;

    private PayloadDecompressor() {
    }

    public static byte[] decompress(byte[] payload, String compression) {
        String name = compression == null ? "" : compression.toUpperCase(Locale.ROOT);
        switch (name) {
            case "":
            case "NONE":
            case "PASS_THROUGH":
                return payload;
            case "GZIP":
                return readFully(() -> new GZIPInputStream(new ByteArrayInputStream(payload)), "gzip");
            case "DEFLATE":
                return readFully(() -> new InflaterInputStream(new ByteArrayInputStream(payload)), "deflate");
            case "SNAPPY":
                return decompressSnappy(payload);
            case "LZ4":
            case "LZ4_FAST":
            case "LZ4_HIGH":
                return decompressLz4(payload);
            case "ZSTD":
            case "ZSTANDARD":
                return decompressZstd(payload);
            default:
                throw ProtocolException.of("unsupported grpc compression: " + compression);
        }
    }

    private static byte[] decompressSnappy(byte[] payload) {
        try {
            int expectedLength = Snappy.uncompressedLength(payload);
            validateLength("snappy", payload.length, expectedLength, SNAPPY_MAX_RATIO);
            if (!Snappy.isValidCompressedBuffer(payload)) {
                throw ProtocolException.of("snappy decompress failed: corrupted input");
            }
            return Snappy.uncompress(payload);
        } catch (IOException e) {
            throw new ProtocolException("snappy decompress failed: " + e.getMessage(), e);
        }
    }

    private static byte[] decompressLz4(byte[] payload) {
        try {
            return ByteStreams.toByteArray(new LZ4FrameInputStream(new ByteArrayInputStream(payload)));
        } catch (IOException | RuntimeException frameError) {
            if (payload.length < LENGTH_PREFIX_BYTES) {
                throw new ProtocolException("lz4 decompress failed: " + frameError.getMessage(), frameError);
            }
            int expectedLength = readLengthPrefix(payload);
            if (expectedLength == 0) {
                return new byte[0];
            }
            validateLength("lz4", payload.length - LENGTH_PREFIX_BYTES, expectedLength, LZ4_MAX_RATIO);
            byte[] output = new byte[expectedLength];
            int n;
            try {
                n = LZ4Factory.fastestInstance().safeDecompressor().decompress(
                        payload, LENGTH_PREFIX_BYTES, payload.length - LENGTH_PREFIX_BYTES, output, 0, expectedLength);
            } catch (LZ4Exception e) {
                throw new ProtocolException(String.format("lz4 decompress failed: frame=%s, length-prefixed=%s",
                        frameError.getMessage(), e.getMessage()), e);
            }
            if (n != expectedLength) {
                throw ProtocolException.of(String.format("lz4 length prefix mismatch: expected %d, got %d", expectedLength, n));
            }
            return output;
        }
    }

    private static byte[] decompressZstd(byte[] payload) {
        try {
            return ByteStreams.toByteArray(new ZstdInputStream(new ByteArrayInputStream(payload)));
        } catch (IOException | RuntimeException frameError) {
            if (payload.length < LENGTH_PREFIX_BYTES) {
                throw new ProtocolException("zstd decompress failed: " + frameError.getMessage(), frameError);
            }
            int expectedLength = readLengthPrefix(payload);
            byte[] compressed = Arrays.copyOfRange(payload, LENGTH_PREFIX_BYTES, payload.length);
            byte[] output;
            try {
                output = ByteStreams.toByteArray(new ZstdInputStream(new ByteArrayInputStream(compressed)));
            } catch (IOException | RuntimeException e) {
                throw new ProtocolException(String.format("zstd decompress failed: frame=%s, length-prefixed=%s",
                        frameError.getMessage(), e.getMessage()), e);
            }
            if (output.length != expectedLength) {
                throw ProtocolException.of(String.format("zstd length prefix mismatch: expected %d, got %d",
                        expectedLength, output.length));
            }
            return output;
        }
    }

    /**
     * 在分配输出缓冲区之前，按压缩算法的最大膨胀比校验声明的原始长度
     */
    private static void validateLength(String algorithm, int compressedLength, long originalLength, long maxRatio) {
        if (originalLength < 0 || originalLength > compressedLength * maxRatio + 16) {
            throw ProtocolException.of(String.format("%s declared length %d is impossible for %d compressed bytes",
                    algorithm, originalLength, compressedLength));
        }
    }

    // 无符号大端 uint32
    private static int readLengthPrefix(byte[] payload) {
        long length = ((payload[0] & 0xFFL) << 24)
                | ((payload[1] & 0xFFL) << 16)
                | ((payload[2] & 0xFFL) << 8)
                | (payload[3] & 0xFFL);
        if (length > MAX_PAYLOAD_LENGTH) {
            throw ProtocolException.of("invalid length prefix: " + length);
        }
        return (int) length;
    }

    private static byte[] readFully(StreamOpener opener, String algorithm) {
        try (InputStream in = opener.open()) {
            return ByteStreams.toByteArray(in);
        } catch (IOException e) {
            throw new ProtocolException(algorithm + " decompress failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface StreamOpener {
        InputStream open() throws IOException;
    }
}
