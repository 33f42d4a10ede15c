package com.vidnyan.rpax.adapter.out.xaml;

/**
 * A workflow file could not be read as XML.
 */
public class XamlParseException extends Exception {

    public XamlParseException(String message) {
        super(message);
    }

    public XamlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
