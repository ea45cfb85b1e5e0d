package com.example.catalog_import.service.source.torrent;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strict bencode decoder for untrusted input. Byte strings decode to {@code byte[]}, integers to
 * {@link Long}, lists to {@link List} and dictionaries to insertion-ordered {@link Map}s with UTF-8 keys.
 */
public final class BencodeDecoder {
    private static final int MAX_DEPTH = 64;

    /**
     * A decoded top-level dictionary together with the raw encoded bytes of each value, needed to hash
     * the {@code info} dictionary exactly as it appeared in the file.
     */
    public record TopLevel(Map<String, Object> values, Map<String, byte[]> rawValues) {}

    private final byte[] data;
    private int pos;
    private int depth;

    private BencodeDecoder(byte[] data) {
        this.data = data;
    }

    public static Object decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new BencodeException("empty input");
        }
        BencodeDecoder decoder = new BencodeDecoder(data);
        Object value = decoder.next();
        if (decoder.pos != data.length) {
            throw new BencodeException("trailing data at offset " + decoder.pos);
        }
        return value;
    }

    public static TopLevel decodeTopLevel(byte[] data) {
        if (data == null || data.length == 0) {
            throw new BencodeException("empty input");
        }
        BencodeDecoder decoder = new BencodeDecoder(data);
        if (data[0] != 'd') {
            throw new BencodeException("top-level value is not a dictionary");
        }
        decoder.pos = 1;
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, byte[]> raw = new LinkedHashMap<>();
        while (decoder.peek() != 'e') {
            String key = new String(decoder.readBytes(), StandardCharsets.UTF_8);
            int start = decoder.pos;
            values.put(key, decoder.next());
            raw.put(key, Arrays.copyOfRange(data, start, decoder.pos));
        }
        decoder.pos++;
        if (decoder.pos != data.length) {
            throw new BencodeException("trailing data at offset " + decoder.pos);
        }
        return new TopLevel(values, raw);
    }

    private Object next() {
        byte b = peek();
        if (b == 'i') {
            return readInteger();
        }
        if (b == 'l') {
            return readList();
        }
        if (b == 'd') {
            return readDictionary();
        }
        if (b >= '0' && b <= '9') {
            return readBytes();
        }
        throw new BencodeException("unexpected byte '" + (char) b + "' at offset " + pos);
    }

    private byte peek() {
        if (pos >= data.length) {
            throw new BencodeException("unexpected end of input");
        }
        return data[pos];
    }

    private long readInteger() {
        pos++;
        int end = indexOf('e');
        String digits = new String(data, pos, end - pos, StandardCharsets.US_ASCII);
        if (digits.isEmpty() || digits.equals("-") || digits.startsWith("-0")
                || (digits.length() > 1 && digits.startsWith("0"))) {
            throw new BencodeException("invalid integer '" + digits + "'");
        }
        try {
            long value = Long.parseLong(digits);
            pos = end + 1;
            return value;
        } catch (NumberFormatException ex) {
            throw new BencodeException("invalid integer '" + digits + "'");
        }
    }

    private byte[] readBytes() {
        int colon = indexOf(':');
        String digits = new String(data, pos, colon - pos, StandardCharsets.US_ASCII);
        int length;
        try {
            length = Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new BencodeException("invalid string length '" + digits + "'");
        }
        if (length < 0 || (digits.length() > 1 && digits.startsWith("0"))) {
            throw new BencodeException("invalid string length '" + digits + "'");
        }
        int start = colon + 1;
        if (start + (long) length > data.length) {
            throw new BencodeException("string length exceeds input at offset " + pos);
        }
        pos = start + length;
        return Arrays.copyOfRange(data, start, start + length);
    }

    private List<Object> readList() {
        enter();
        pos++;
        List<Object> list = new ArrayList<>();
        while (peek() != 'e') {
            list.add(next());
        }
        pos++;
        depth--;
        return list;
    }

    private Map<String, Object> readDictionary() {
        enter();
        pos++;
        Map<String, Object> dict = new LinkedHashMap<>();
        while (peek() != 'e') {
            if (peek() < '0' || peek() > '9') {
                throw new BencodeException("dictionary key is not a string at offset " + pos);
            }
            String key = new String(readBytes(), StandardCharsets.UTF_8);
            dict.put(key, next());
        }
        pos++;
        depth--;
        return dict;
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new BencodeException("nesting deeper than " + MAX_DEPTH);
        }
    }

    private int indexOf(char c) {
        for (int i = pos; i < data.length && i - pos < 32; i++) {
            if (data[i] == c) {
                return i;
            }
        }
        throw new BencodeException("missing '" + c + "' after offset " + pos);
    }
}
