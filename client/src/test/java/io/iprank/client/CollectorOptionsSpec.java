package io.iprank.client;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CollectorOptionsSpec {

    private static final URI BASE = URI.create("http://localhost:8080");

    @Test
    void defaults() {
        CollectorOptions o = CollectorOptions.parse(BASE, new String[0]);
        assertEquals(CollectorOptions.DEFAULT_TEMPLATE, o.downloadUrlTemplate());
        assertEquals(5_000_000L, o.bytes());
        assertEquals(20, o.concurrency());
        assertEquals(Duration.ofSeconds(15), o.timeout());
        assertNull(o.partition());
        assertEquals("X-Network-Origin", o.partitionHeader());
    }

    @Test
    void flags_override_defaults() {
        CollectorOptions o = CollectorOptions.parse(BASE, new String[]{
                "--bytes", "1000",
                "--concurrency", "4",
                "--timeout-seconds", "3",
                "--partition", "4134",
                "--partition-header", "X-Asn",
                "--download-url-template", "https://{endpoint}/dl?bytes={bytes}"
        });
        assertEquals(1000, o.bytes());
        assertEquals(4, o.concurrency());
        assertEquals(Duration.ofSeconds(3), o.timeout());
        assertEquals("4134", o.partition());
        assertEquals("X-Asn", o.partitionHeader());
        assertEquals("https://{endpoint}/dl?bytes={bytes}", o.downloadUrlTemplate());
    }

    @Test
    void invalid_flags_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> CollectorOptions.parse(BASE, new String[]{"--bogus", "1"}));
        assertThrows(IllegalArgumentException.class, () -> CollectorOptions.parse(BASE, new String[]{"--bytes"}));
        assertThrows(IllegalArgumentException.class, () -> CollectorOptions.parse(BASE, new String[]{"--concurrency", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> CollectorOptions.parse(BASE, new String[]{"--download-url-template", "http://fixed/dl"}));
    }
}
