package org.bucketindex.store;

import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Parquet {@link OutputFile} writing to a local path through a {@link FileChannel}.
 */
final class NioOutputFile implements OutputFile {
	private final Path path;

	NioOutputFile(Path path) {
		this.path = path;
	}

	@Override
	public PositionOutputStream create(long blockSizeHint) throws IOException {
		if (Files.exists(path)) {
			throw new FileAlreadyExistsException(path.toString());
		}
		return createOrOverwrite(blockSizeHint);
	}

	@Override
	public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		FileChannel channel = FileChannel.open(path,
				StandardOpenOption.WRITE,
				StandardOpenOption.CREATE,
				StandardOpenOption.TRUNCATE_EXISTING);
		return new ChannelOutputStream(channel);
	}

	@Override
	public boolean supportsBlockSize() {
		return false;
	}

	@Override
	public long defaultBlockSize() {
		return 0;
	}

	@Override
	public String getPath() {
		return path.toString();
	}

	private static final class ChannelOutputStream extends PositionOutputStream {
		private final FileChannel channel;
		private long pos;

		ChannelOutputStream(FileChannel channel) {
			this.channel = channel;
		}

		@Override
		public long getPos() {
			return pos;
		}

		@Override
		public void write(int b) throws IOException {
			write(new byte[] {(byte) b}, 0, 1);
		}

		@Override
		public void write(byte[] b, int off, int len) throws IOException {
			ByteBuffer buffer = ByteBuffer.wrap(b, off, len);
			while (buffer.hasRemaining()) {
				pos += channel.write(buffer, pos);
			}
		}

		@Override
		public void close() throws IOException {
			channel.close();
		}
	}
}
