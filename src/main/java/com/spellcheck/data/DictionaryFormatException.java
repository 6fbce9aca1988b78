package com.spellcheck.data;

/**
 * Raised when a dictionary entry has a frequency field that is not an unsigned decimal integer.
 * The load that hit it is abandoned as a whole.
 */
public class DictionaryFormatException extends RuntimeException {

    private final long entryNumber;
    private final String entry;

    public DictionaryFormatException(long entryNumber, String entry, Throwable cause) {
        super("Malformed dictionary entry #" + entryNumber + ": '" + entry + "'", cause);
        this.entryNumber = entryNumber;
        this.entry = entry;
    }

    public long getEntryNumber() {
        return entryNumber;
    }

    public String getEntry() {
        return entry;
    }
}
