package com.rankengine.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 压缩的内存倒排列表
 *
 * 每个倒排项按 (docId差值, 词频) 两个VarInt顺序写入字节数组，
 * 第一个倒排项的差值以 0 为基准。迭代时按顺序解码还原。
 *
 * 示例：docIds [10, 15, 20] -> 差值 [10, 5, 5]
 */
public final class CompressedPostingList implements PostingList {
    private static final int INITIAL_CAPACITY = 16;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;
    private int size;
    private int lastDocId = -1;
    private boolean frozen;

    @Override
    public void append(Posting posting) {
        if (frozen) {
            throw new IllegalStateException("倒排列表已冻结，不能追加");
        }
        if (posting.docId() <= lastDocId) {
            throw new IllegalArgumentException("docIds必须严格递增，last=" + lastDocId + ", current=" + posting.docId());
        }
        int delta = size == 0 ? posting.docId() : posting.docId() - lastDocId;
        ensureCapacity(2 * VarIntCodec.MAX_VARINT_BYTES);
        length = VarIntCodec.writeVarInt(delta, buffer, length);
        length = VarIntCodec.writeVarInt(posting.termFrequency(), buffer, length);
        lastDocId = posting.docId();
        size++;
    }

    @Override
    public void freeze() {
        if (!frozen) {
            buffer = Arrays.copyOf(buffer, length);
            frozen = true;
        }
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * 返回编码后占用的字节数。
     */
    public int byteSize() {
        return length;
    }

    @Override
    public Iterator<Posting> iterator() {
        ByteBuffer encoded = ByteBuffer.wrap(buffer, 0, length).asReadOnlyBuffer();
        int snapshotSize = size;
        return new Iterator<>() {
            private int decoded;
            private int previousDocId;

            @Override
            public boolean hasNext() {
                return decoded < snapshotSize;
            }

            @Override
            public Posting next() {
                if (decoded >= snapshotSize) {
                    throw new NoSuchElementException();
                }
                try {
                    int docId = previousDocId + VarIntCodec.readVarInt(encoded);
                    int termFrequency = VarIntCodec.readVarInt(encoded);
                    previousDocId = docId;
                    decoded++;
                    return new Posting(docId, termFrequency);
                } catch (IOException exception) {
                    throw new UncheckedIOException("倒排列表解码失败，位置=" + decoded, exception);
                }
            }
        };
    }

    private void ensureCapacity(int extraBytes) {
        if (length + extraBytes > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + extraBytes));
        }
    }
}
