package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public final class NioInputFile implements InputFile {

    private final Path path;

    public NioInputFile(Path path) {
        this.path = path;
    }

    @Override
    public long getLength() throws IOException {
        return Files.size(path);
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new ChannelSeekableInputStream(FileChannel.open(path, StandardOpenOption.READ));
    }

    @Override
    public String toString() {
        return path.toString();
    }

    private static final class ChannelSeekableInputStream extends SeekableInputStream {

        private final FileChannel channel;
        private long pos;

        private ChannelSeekableInputStream(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public int read() throws IOException {
            ByteBuffer one = ByteBuffer.allocate(1);
            int n = channel.read(one, pos);
            if (n <= 0) {
                return -1;
            }
            pos += n;
            one.flip();
            return one.get() & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = channel.read(ByteBuffer.wrap(b, off, len), pos);
            if (n > 0) {
                pos += n;
            }
            return n;
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            int n = channel.read(dst, pos);
            if (n > 0) {
                pos += n;
            }
            return n;
        }

        @Override
        public void readFully(byte[] bytes) throws IOException {
            readFully(bytes, 0, bytes.length);
        }

        @Override
        public void readFully(byte[] bytes, int off, int len) throws IOException {
            int read = 0;
            while (read < len) {
                int n = read(bytes, off + read, len - read);
                if (n < 0) {
                    throw new EOFException("Unexpected end of parquet file after " + read + " of " + len + " bytes");
                }
                read += n;
            }
        }

        @Override
        public void readFully(ByteBuffer dst) throws IOException {
            while (dst.hasRemaining()) {
                if (read(dst) < 0) {
                    throw new EOFException("Unexpected end of parquet file");
                }
            }
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void seek(long newPos) {
            this.pos = newPos;
        }

        @Override
        public int available() throws IOException {
            long remaining = channel.size() - pos;
            return remaining > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) Math.max(remaining, 0);
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
