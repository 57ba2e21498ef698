package com.citewise.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RedirectUrlResolver.
 */
class RedirectUrlResolverTest {

    @Test
    void testProtocolRelativeRedirect() {
        assertEquals("https://docs.python.org/3/library/asyncio.html",
                RedirectUrlResolver.resolve("//duckduckgo.com/l/?uddg=https%3A%2F%2Fdocs.python.org%2F3%2Flibrary%2Fasyncio.html&rut=abc"));
    }

    @Test
    void testRelativeRedirect() {
        assertEquals("https://example.com/a?b=c",
                RedirectUrlResolver.resolve("/l/?kh=-1&uddg=https%3A%2F%2Fexample.com%2Fa%3Fb%3Dc"));
    }

    @Test
    void testDirectLinkIsReturnedUnchanged() {
        assertEquals("https://example.com/page", RedirectUrlResolver.resolve("  https://example.com/page "));
    }

    @Test
    void testRedirectWithoutDestination() {
        assertEquals("", RedirectUrlResolver.resolve("//duckduckgo.com/l/?rut=abc"));
        assertEquals("", RedirectUrlResolver.resolve(null));
        assertEquals("", RedirectUrlResolver.resolve(" "));
    }

    @Test
    void testIsAbsoluteHttpUrl() {
        assertTrue(RedirectUrlResolver.isAbsoluteHttpUrl("https://example.com"));
        assertTrue(RedirectUrlResolver.isAbsoluteHttpUrl("HTTP://example.com/x"));
        assertFalse(RedirectUrlResolver.isAbsoluteHttpUrl("/relative/path"));
        assertFalse(RedirectUrlResolver.isAbsoluteHttpUrl("javascript:void(0)"));
        assertFalse(RedirectUrlResolver.isAbsoluteHttpUrl("ftp://example.com/file"));
        assertFalse(RedirectUrlResolver.isAbsoluteHttpUrl("https://exa mple.com"));
        assertFalse(RedirectUrlResolver.isAbsoluteHttpUrl(null));
    }
}
