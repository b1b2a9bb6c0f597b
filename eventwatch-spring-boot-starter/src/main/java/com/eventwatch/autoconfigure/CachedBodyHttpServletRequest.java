package com.eventwatch.autoconfigure;

import com.eventwatch.core.form.FormUrlEncodedParser;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.SequenceInputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers a URL-encoded form body so it can be scanned and still be read by
 * the application afterwards.
 *
 * <p>
 * Up to {@code maxBodyBytes} are held in memory. A fully buffered body can be
 * read any number of times, and the parameter methods are answered from the
 * buffer merged with the query string, because the container can no longer
 * parse a stream that has already been consumed. A longer body is handed back
 * once as buffered prefix plus unread remainder and is not scanned.
 * </p>
 *
 * <p>
 * When an earlier filter already consumed the stream (Spring Security's CSRF
 * lookup, {@code FormContentFilter}), the body fields are recovered from the
 * container's parameter map instead and every request method is delegated.
 * </p>
 */
public class CachedBodyHttpServletRequest extends HttpServletRequestWrapper {

    private final byte[] buffered;
    private final boolean fullyBuffered;
    private final boolean consumedUpstream;
    private final Charset charset;
    private final Map<String, List<String>> formFields;
    private InputStream remainder;
    private Map<String, String[]> parameterMap;

    public CachedBodyHttpServletRequest(HttpServletRequest request, int maxBodyBytes) throws IOException {
        super(request);
        this.charset = resolveCharset(request.getCharacterEncoding());

        InputStream in = request.getInputStream();
        byte[] read = in.readNBytes(maxBodyBytes + 1);

        if (read.length > maxBodyBytes) {
            this.buffered = read;
            this.fullyBuffered = false;
            this.consumedUpstream = false;
            this.remainder = in;
            this.formFields = Map.of();
        } else if (read.length == 0 && request.getContentLengthLong() != 0) {
            this.buffered = read;
            this.fullyBuffered = true;
            this.consumedUpstream = true;
            this.formFields = bodyFieldsFromContainer(request, charset);
        } else {
            this.buffered = read;
            this.fullyBuffered = true;
            this.consumedUpstream = false;
            this.formFields = FormUrlEncodedParser.parse(new String(read, charset), charset);
        }
    }

    /** Decoded body fields in arrival order; empty when the body was too large. */
    public Map<String, List<String>> getFormFields() {
        return formFields;
    }

    public boolean isFullyBuffered() {
        return fullyBuffered;
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (consumedUpstream) {
            return super.getInputStream();
        }
        if (fullyBuffered) {
            return new BufferedServletInputStream(new ByteArrayInputStream(buffered));
        }
        if (remainder == null) {
            throw new IllegalStateException("Request body has already been read");
        }
        InputStream stream = new SequenceInputStream(new ByteArrayInputStream(buffered), remainder);
        remainder = null;
        return new BufferedServletInputStream(stream);
    }

    @Override
    public BufferedReader getReader() throws IOException {
        if (consumedUpstream) {
            return super.getReader();
        }
        return new BufferedReader(new InputStreamReader(getInputStream(), charset));
    }

    @Override
    public String getParameter(String name) {
        if (!answersParameters()) {
            return super.getParameter(name);
        }
        String[] values = getParameterMap().get(name);
        return values != null && values.length > 0 ? values[0] : null;
    }

    @Override
    public Map<String, String[]> getParameterMap() {
        if (!answersParameters()) {
            return super.getParameterMap();
        }
        if (parameterMap == null) {
            parameterMap = mergeParameters();
        }
        return parameterMap;
    }

    @Override
    public Enumeration<String> getParameterNames() {
        if (!answersParameters()) {
            return super.getParameterNames();
        }
        return Collections.enumeration(getParameterMap().keySet());
    }

    @Override
    public String[] getParameterValues(String name) {
        if (!answersParameters()) {
            return super.getParameterValues(name);
        }
        String[] values = getParameterMap().get(name);
        return values != null ? values.clone() : null;
    }

    private boolean answersParameters() {
        return fullyBuffered && !consumedUpstream;
    }

    private Map<String, String[]> mergeParameters() {
        Map<String, List<String>> merged = new LinkedHashMap<>();
        FormUrlEncodedParser.parse(getQueryString(), charset)
                .forEach((name, values) -> merged.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values));
        formFields.forEach((name, values) -> merged.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values));

        Map<String, String[]> result = new LinkedHashMap<>();
        merged.forEach((name, values) -> result.put(name, values.toArray(new String[0])));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Container parameters minus the ones the query string accounts for.
     */
    private static Map<String, List<String>> bodyFieldsFromContainer(HttpServletRequest request, Charset charset) {
        Map<String, List<String>> query = FormUrlEncodedParser.parse(request.getQueryString(), charset);
        Map<String, List<String>> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String[]> entry : request.getParameterMap().entrySet()) {
            List<String> values = new ArrayList<>(List.of(entry.getValue()));
            for (String fromQuery : query.getOrDefault(entry.getKey(), List.of())) {
                values.remove(fromQuery);
            }
            if (!values.isEmpty()) {
                fields.put(entry.getKey(), Collections.unmodifiableList(values));
            }
        }
        return Collections.unmodifiableMap(fields);
    }

    private static Charset resolveCharset(String encoding) {
        if (encoding == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static final class BufferedServletInputStream extends ServletInputStream {

        private final InputStream delegate;
        private boolean finished;

        BufferedServletInputStream(InputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public int read() throws IOException {
            int b = delegate.read();
            if (b < 0) {
                finished = true;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = delegate.read(b, off, len);
            if (n < 0) {
                finished = true;
            }
            return n;
        }

        @Override
        public boolean isFinished() {
            return finished;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            throw new UnsupportedOperationException("Async reads are not supported on a buffered body");
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }
}
