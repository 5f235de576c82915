package com.questrail.prt7.transport.stream;

import com.questrail.prt7.transport.LineSource;
import com.questrail.prt7.transport.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * ReaderLineSource
 * -----------------------------------------------------------------------------
 * Blocking {@link LineSource} over a character stream (standard input or a
 * recorded capture file).
 *
 * <p>{@link BufferedReader#readLine()} strips {@code \n}, {@code \r} and
 * {@code \r\n}. End of input makes the source exhausted; it never reports a
 * transient absence of data.</p>
 */
public final class ReaderLineSource implements LineSource
{
    private static final Logger log = LoggerFactory.getLogger(ReaderLineSource.class);

    private final BufferedReader reader;
    private final String description;

    private boolean exhausted;
    private boolean closed;

    public ReaderLineSource(Reader reader, String description)
    {
        Objects.requireNonNull(reader, "reader");
        this.reader = (reader instanceof BufferedReader buffered) ? buffered : new BufferedReader(reader);
        this.description = Objects.requireNonNull(description, "description");
    }

    /**
     * Reads ASCII lines from the given stream; the stream is closed with this source.
     */
    public static ReaderLineSource fromStream(InputStream in, String description)
    {
        return new ReaderLineSource(new InputStreamReader(in, StandardCharsets.US_ASCII), description);
    }

    /**
     * Opens a capture file containing one frame per line.
     *
     * @throws TransportFailureException if the file cannot be opened
     */
    public static ReaderLineSource fromFile(Path file)
    {
        try {
            return new ReaderLineSource(Files.newBufferedReader(file, StandardCharsets.US_ASCII), file.toString());
        }
        catch (IOException e) {
            throw new TransportFailureException("cannot open capture file " + file, e);
        }
    }

    @Override
    public Optional<String> nextLine()
    {
        if (exhausted || closed) {
            return Optional.empty();
        }
        try {
            String line = reader.readLine();
            if (line == null) {
                exhausted = true;
                log.debug("End of stream reached on {}", description);
                return Optional.empty();
            }
            return Optional.of(line);
        }
        catch (IOException e) {
            throw new TransportFailureException("read failed on " + description, e);
        }
    }

    @Override
    public boolean isExhausted()
    {
        return exhausted || closed;
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        try {
            reader.close();
        }
        catch (IOException e) {
            log.warn("Failed to close {}", description, e);
        }
    }

    @Override
    public String toString()
    {
        return "ReaderLineSource[" + description + ']';
    }
}
