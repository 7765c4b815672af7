package com.neuroassist.stroke.model;

import com.neuroassist.stroke.exception.ValidationException;

import java.io.Serializable;
import java.net.URI;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Set;

/**
 * Opaque reference to a CT scan: either the image bytes themselves or a URI the image-analysis
 * capability can fetch. The engine never looks at the pixels.
 */
public final class CtScanImage implements Serializable {

    public static final long MAX_INLINE_BYTES = 5L * 1024 * 1024;
    public static final Set<String> ACCEPTED_MIME_TYPES = Set.of("image/jpeg", "image/jpg", "image/png");

    private final byte[] data;
    private final String mimeType;
    private final URI uri;

    private CtScanImage(byte[] data, String mimeType, URI uri) {
        this.data = data;
        this.mimeType = mimeType;
        this.uri = uri;
    }

    public static CtScanImage inline(byte[] data, String mimeType) {
        if (data == null || data.length == 0) {
            throw new ValidationException("ctScanImage", "CT scan image is empty");
        }
        if (data.length > MAX_INLINE_BYTES) {
            throw new ValidationException("ctScanImage", "Max image size is 5MB.");
        }
        if (mimeType == null || !ACCEPTED_MIME_TYPES.contains(mimeType.toLowerCase())) {
            throw new ValidationException("ctScanImage", "Only .jpg, .jpeg, and .png formats are supported.");
        }
        return new CtScanImage(data.clone(), mimeType.toLowerCase(), null);
    }

    public static CtScanImage remote(URI uri) {
        if (uri == null || uri.getScheme() == null
                || !(uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))) {
            throw new ValidationException("ctScanImage", "CT scan image URI must be http or https: " + uri);
        }
        return new CtScanImage(null, null, uri);
    }

    public boolean isInline() {
        return data != null;
    }

    public byte[] data() {
        return data == null ? null : data.clone();
    }

    public String base64Data() {
        return data == null ? null : Base64.getEncoder().encodeToString(data);
    }

    public String mimeType() {
        return mimeType;
    }

    public URI uri() {
        return uri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CtScanImage other)) return false;
        return Arrays.equals(data, other.data)
                && Objects.equals(mimeType, other.mimeType)
                && Objects.equals(uri, other.uri);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(mimeType, uri) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return isInline()
                ? "CtScanImage[inline " + mimeType + ", " + data.length + " bytes]"
                : "CtScanImage[" + uri + "]";
    }
}
