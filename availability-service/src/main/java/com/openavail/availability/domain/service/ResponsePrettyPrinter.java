package com.openavail.availability.domain.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;

/**
 * Two-space indented layout of the supplier response: {@code "id": "A#1"} with no space
 * before the colon, and empty containers written as {@code []} / {@code {}}.
 */
class ResponsePrettyPrinter extends DefaultPrettyPrinter {

    private static final DefaultIndenter TWO_SPACES = new DefaultIndenter("  ", "\n");

    ResponsePrettyPrinter() {
        indentArraysWith(TWO_SPACES);
        indentObjectsWith(TWO_SPACES);
    }

    private ResponsePrettyPrinter(ResponsePrettyPrinter base) {
        super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new ResponsePrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
