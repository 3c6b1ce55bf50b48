package com.wsdlbridge.generator.fetch;

import java.io.IOException;

import com.wsdlbridge.generator.model.SourceLocation;

/**
 * Retrieves the raw bytes of an interface document or schema fragment. Decoding is left to
 * the XML parser so the document's own encoding declaration applies.
 */
public interface DocumentFetcher {

    byte[] fetch(SourceLocation location) throws IOException;
}
