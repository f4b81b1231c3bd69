package com.example.assetembed.model;

/**
 * Estimated effect of a decision: HTTP requests avoided and bytes added to the page.
 */
public final class Savings {

    private final int httpRequests;
    private final long bytes;

    public Savings(int httpRequests, long bytes) {
        this.httpRequests = httpRequests;
        this.bytes = bytes;
    }

    public int getHttpRequests() { return httpRequests; }
    public long getBytes() { return bytes; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Savings)) return false;
        Savings other = (Savings) o;
        return httpRequests == other.httpRequests && bytes == other.bytes;
    }

    @Override
    public int hashCode() {
        return 31 * httpRequests + Long.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Savings{httpRequests=" + httpRequests + ", bytes=" + bytes + "}";
    }
}
