package org.iceforge.influxexporter.lineprotocol;

/**
 * Raised when a line-protocol payload contains at least one line that cannot be decoded.
 */
public class LineProtocolException extends Exception {

    public LineProtocolException(String message) {
        super(message);
    }
}
