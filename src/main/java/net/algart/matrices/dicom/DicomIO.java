/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.dicom;

import org.scijava.io.handle.BytesHandle;
import org.scijava.io.handle.DataHandle;
import org.scijava.io.handle.FileHandle;
import org.scijava.io.location.BytesLocation;
import org.scijava.io.location.FileLocation;
import org.scijava.io.location.Location;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public sealed abstract class DicomIO implements Closeable permits DicomFileReader, DicomWriter {
    public static final int PREAMBLE_LENGTH = 128;
    public static final byte[] DICM_PREFIX = {'D', 'I', 'C', 'M'};

    static final System.Logger LOG = System.getLogger(DicomIO.class.getName());
    static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    public static final boolean BUILT_IN_TIMING = getBooleanProperty("net.algart.matrices.dicom.timing");

    final DataHandle<? extends Location> stream;
    final Object fileLock = new Object();

    DicomIO(DataHandle<? extends Location> stream) {
        this.stream = Objects.requireNonNull(stream, "Null data handle (input/output stream)");
    }

    /**
     * Returns the input/output stream for operation with this DICOM file.
     */
    public DataHandle<? extends Location> stream() {
        synchronized (fileLock) {
            // - we prefer not to return this stream in the middle of I/O operations
            return stream;
        }
    }

    public long fileLength() {
        try {
            return stream.length();
        } catch (IOException e) {
            // - very improbable, it is better just to return something
            return 0;
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (fileLock) {
            stream.close();
        }
    }

    public static DataHandle<Location> getExistingFileHandle(Path file) throws FileNotFoundException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("File " + file
                    + (Files.exists(file) ? " is not a regular file" : " does not exist"));
        }
        return getFileHandle(file);
    }

    public static DataHandle<Location> getFileHandle(Path file) {
        Objects.requireNonNull(file, "Null file");
        return getFileHandle(new FileLocation(file.toFile()));
    }

    /**
     * Returns a handle for reading/writing the given byte array.
     *
     * <p>Warning: you should never call {@link DataHandle#set(Object)} method of the returned result!
     * It can lead to unpredictable <code>ClassCastException</code>.
     */
    @SuppressWarnings("rawtypes, unchecked")
    public static DataHandle<Location> getBytesHandle(BytesLocation bytesLocation) {
        Objects.requireNonNull(bytesLocation, "Null bytesLocation");
        BytesHandle bytesHandle = new BytesHandle(bytesLocation);
        return (DataHandle) bytesHandle;
    }

    public static DataHandle<Location> getBytesHandle(byte[] bytes) {
        Objects.requireNonNull(bytes, "Null bytes");
        return getBytesHandle(new BytesLocation(bytes));
    }

    /**
     * Returns a new empty handle for writing into memory. The written data can be retrieved
     * by {@link #readAllBytes(DataHandle)}.
     */
    public static DataHandle<Location> newBytesHandle() {
        return getBytesHandle(new BytesLocation(0));
    }

    /**
     * Reads all bytes of the handle from the beginning. The current position is moved to the end.
     *
     * @param handle any data handle.
     * @return the whole content.
     * @throws IOException in the case of I/O error.
     */
    public static byte[] readAllBytes(DataHandle<? extends Location> handle) throws IOException {
        Objects.requireNonNull(handle, "Null handle");
        final long length = handle.length();
        if (length > Integer.MAX_VALUE) {
            throw new IOException("Too large data: " + length + " >= 2^31 bytes");
        }
        handle.seek(0);
        final byte[] result = new byte[(int) length];
        handle.readFully(result);
        return result;
    }

    /**
     * Warning: you should never call {@link DataHandle#set(Object)} method of the returned result!
     * It can lead to unpredictable <code>ClassCastException</code>.
     */
    @SuppressWarnings("rawtypes, unchecked")
    static DataHandle<Location> getFileHandle(FileLocation fileLocation) {
        Objects.requireNonNull(fileLocation, "Null fileLocation");
        FileHandle fileHandle = new FileHandle(fileLocation);
        fileHandle.setLittleEndian(true);
        return (DataHandle) fileHandle;
    }

    public static long debugTime() {
        return BUILT_IN_TIMING && LOGGABLE_DEBUG ? System.nanoTime() : 0;
    }

    public static String prettyFileName(String format, DataHandle<? extends Location> handle) {
        if (handle == null) {
            return "";
        }
        Location location = handle.get();
        if (location == null) {
            return "";
        }
        URI uri = location.getURI();
        if (uri == null) {
            return "";
        }
        return format.formatted(uri);
    }

    static boolean getBooleanProperty(String propertyName) {
        try {
            return Boolean.getBoolean(propertyName);
        } catch (Exception e) {
            return false;
        }
    }
}
