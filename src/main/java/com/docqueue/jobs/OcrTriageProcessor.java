package com.docqueue.jobs;

import com.docqueue.core.BaseProcessor;
import com.docqueue.core.ProcessingContext;
import com.docqueue.core.ProcessingException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Built-in OCR triage: checks that the primary file looks like a PDF and records
 * its version and size.
 *
 * <p>The processor reads the first {@value #HEADER_BYTES} bytes and looks for a
 * {@code %PDF-d.d} marker before the first NUL byte. On success the metadata file is replaced by</p>
 * <pre>{"ocr_status":"complete","ocr_provider":"builtin","pdf_version":"1.7","bytes_scanned":12345}</pre>
 * <p>On failure the worker records {@code {"error":"ocr_failed","detail":...}}
 * with one of the details {@code parse_error}, {@code provider_not_found},
 * {@code not_found} or {@code io_error}.</p>
 *
 * <p>The submitted metadata may select a provider with {@code {"provider": "..."}};
 * only {@code builtin} exists.</p>
 */
public class OcrTriageProcessor extends BaseProcessor {
    private static final Logger logger = Logger.getLogger(OcrTriageProcessor.class.getName());

    public static final String NAME = "ocr-triage";
    public static final String PROVIDER = "builtin";
    static final int HEADER_BYTES = 64;

    private static final String ERROR_CODE = "ocr_failed";
    private static final String MARKER = "%PDF-";

    public static class OcrOptions {
        public String provider;

        public OcrOptions() {}
    }

    public OcrTriageProcessor() {
        super(NAME);
    }

    @Override
    public void process(ProcessingContext context) throws Exception {
        String provider = requestedProvider(context);
        if (!PROVIDER.equals(provider)) {
            throw new ProcessingException(ERROR_CODE, "provider_not_found");
        }

        Path pdf = context.getPdfFile();
        byte[] header;
        long size;
        try (InputStream in = Files.newInputStream(pdf)) {
            // The last byte is reserved, so at most 63 bytes are examined
            header = in.readNBytes(HEADER_BYTES - 1);
            size = Files.size(pdf);
        } catch (NoSuchFileException e) {
            throw new ProcessingException(ERROR_CODE, "not_found", e);
        } catch (IOException e) {
            throw new ProcessingException(ERROR_CODE, "io_error", e);
        }

        String version = parseVersion(header);
        if (version == null) {
            throw new ProcessingException(ERROR_CODE, "parse_error");
        }
        logger.info("Job " + context.getJobId() + " is PDF " + version + ", " + size + " bytes");

        context.addResult("ocr_status", "complete");
        context.addResult("ocr_provider", provider);
        context.addResult("pdf_version", version);
        context.addResult("bytes_scanned", size);
    }

    /**
     * Find {@code %PDF-d.d} in the header, up to the first NUL byte.
     *
     * @param header the leading bytes of the file
     * @return the version as "major.minor", or null if absent or malformed
     */
    static String parseVersion(byte[] header) {
        int end = 0;
        while (end < header.length && header[end] != 0) {
            end++;
        }
        if (end == 0) {
            return null;
        }
        // ISO-8859-1 maps bytes one to one, so binary noise cannot shift offsets
        String text = new String(header, 0, end, StandardCharsets.ISO_8859_1);
        int found = text.indexOf(MARKER);
        if (found < 0) {
            return null;
        }
        int start = found + MARKER.length();
        if (start + 3 > text.length()) {
            return null;
        }
        char major = text.charAt(start);
        char dot = text.charAt(start + 1);
        char minor = text.charAt(start + 2);
        if (!Character.isDigit(major) || dot != '.' || !Character.isDigit(minor)) {
            return null;
        }
        return major + "." + minor;
    }

    // Unreadable or non-object metadata selects the default provider
    private String requestedProvider(ProcessingContext context) throws IOException {
        OcrOptions options;
        try {
            options = fromMetadata(context.readMetadata(), OcrOptions.class);
        } catch (ProcessingException e) {
            logger.fine("Metadata of " + context.getJobId() + " is not an options object, using " + PROVIDER);
            return PROVIDER;
        }
        if (options == null || options.provider == null || options.provider.isBlank()) {
            return PROVIDER;
        }
        return options.provider;
    }
}
