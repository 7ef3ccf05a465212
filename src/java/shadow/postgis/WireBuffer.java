package shadow.postgis;

import java.nio.ByteBuffer;

/**
 * Growable output buffer encode plans append parameter bytes to.
 */
public class WireBuffer {
    // most geometries are small, large ones grow in blocks
    public static final int BLOCK_SIZE = 1024;
    private ByteBuffer out;

    public WireBuffer() {
        this(BLOCK_SIZE);
    }

    public WireBuffer(int initialSize) {
        this.out = ByteBuffer.allocate(Math.max(initialSize, 16));
    }

    private void maybeGrow(int bytesComing) {
        if (this.out.remaining() < bytesComing) {
            ByteBuffer larger = ByteBuffer.allocate(this.out.capacity() + Math.max(BLOCK_SIZE, bytesComing));

            out.flip();
            larger.put(out);

            this.out = larger;
        }
    }

    public void int32(int val) {
        maybeGrow(4);
        out.putInt(val);
    }

    public void int8(int b) {
        maybeGrow(1);
        out.put((byte) b);
    }

    public void write(byte[] in) {
        maybeGrow(in.length);
        out.put(in);
    }

    public void put(ByteBuffer in) {
        maybeGrow(in.remaining());
        out.put(in);
    }

    public int size() {
        return out.position();
    }

    public int capacity() {
        return out.capacity();
    }

    /**
     * copy of everything written since the last reset
     */
    public byte[] toByteArray() {
        byte[] bytes = new byte[out.position()];
        System.arraycopy(out.array(), out.arrayOffset(), bytes, 0, bytes.length);
        return bytes;
    }

    public void reset() {
        out.clear();
    }
}
