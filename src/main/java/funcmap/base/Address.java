package funcmap.base;

/**
 * An address in the binary under analysis.
 * The offset is treated as an unsigned 64-bit value, wide enough for any
 * target pointer width. Addresses are never validated here: whatever the
 * recovery driver hands us is stored as-is.
 */
public final class Address implements Comparable<Address> {
    private final long offset;

    private Address(long offset) {
        this.offset = offset;
    }

    public static Address of(long offset) {
        return new Address(offset);
    }

    /**
     * Parse an address from text, either "0x"-prefixed hex or plain decimal.
     * @param text the address text
     * @return the parsed address
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit number
     */
    public static Address parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Address text is null");
        }
        String trimmed = text.trim();
        try {
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                return new Address(Long.parseUnsignedLong(trimmed.substring(2), 16));
            }
            return new Address(Long.parseUnsignedLong(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid address: " + text, e);
        }
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public int compareTo(Address other) {
        return Long.compareUnsigned(offset, other.offset);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Address other)) {
            return false;
        }
        return offset == other.offset;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return String.format("0x%08x", offset);
    }
}
