package com.queryscope.platform.serialization;

import com.queryscope.platform.base.Result;

/**
 * Converts one type to and from bytes without throwing.
 *
 * @param <A> The type to serialize/deserialize
 */
public interface Codec<A> {

    Result<byte[]> encode(A value);

    Result<A> decode(byte[] bytes);

    /** MIME type of the encoded form, sent as Content-Type. */
    String contentType();

    /** Short name for log lines. */
    default String name() {
        return contentType();
    }
}
