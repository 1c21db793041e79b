package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.io.RandomAccessFile;

/*
 * easier to intercept the final native class by wrapping it in an interface
 */
record DirectFileOperations(RandomAccessFile randomAccessFile) implements FileOperations {

  @Override
  public void sync() throws IOException {
    randomAccessFile.getChannel().force(false);
  }

  @Override
  public void readFully(long position, byte[] b) throws IOException {
    randomAccessFile.seek(position);
    randomAccessFile.readFully(b);
  }

  @Override
  public void write(long position, byte[] b) throws IOException {
    randomAccessFile.seek(position);
    randomAccessFile.write(b);
  }

  @Override
  public long length() throws IOException {
    return randomAccessFile.length();
  }

  @Override
  public void close() throws IOException {
    randomAccessFile.close();
  }
}
