package com.rankengine.storage;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 *
 * 压缩倒排列表用它保存docId差值和词频，二者通常都很小。
 */
public final class VarIntCodec {

    /** 一个int编码后的最大字节数 */
    public static final int MAX_VARINT_BYTES = 5;

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将int值编码为VarInt并写入字节数组
     *
     * @param value 要编码的值（必须非负）
     * @param dest 目标数组，调用方保证剩余空间足够
     * @param offset 写入起点
     * @return 写入结束后的下一个位置
     * @throws IllegalArgumentException 如果value为负数
     */
    public static int writeVarInt(int value, byte[] dest, int offset) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }

        int position = offset;
        // 循环处理，每次取7位
        while ((value & ~0x7F) != 0) {
            dest[position++] = (byte) ((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        dest[position++] = (byte) (value & 0x7F);
        return position;
    }

    /**
     * 从ByteBuffer读取VarInt并解码为int
     *
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 如果VarInt格式错误或缓冲区不足
     */
    public static int readVarInt(ByteBuffer buf) throws IOException {
        int result = 0;
        int shift = 0;

        while (shift < 32) {
            if (!buf.hasRemaining()) {
                throw new IOException("ByteBuffer不足，无法读取完整VarInt");
            }

            int b = buf.get() & 0xFF;
            result |= (b & 0x7F) << shift;

            if ((b & 0x80) == 0) {
                return result;
            }

            shift += 7;
        }

        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 计算int值编码为VarInt所需的字节数
     *
     * @param value 要编码的值（必须非负）
     * @return 所需字节数
     * @throws IllegalArgumentException 如果value为负数
     */
    public static int varIntSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }

        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
