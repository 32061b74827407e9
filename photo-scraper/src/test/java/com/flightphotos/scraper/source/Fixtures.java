package com.flightphotos.scraper.source;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

final class Fixtures {

    private Fixtures() {}

    static Document html(String name, String baseUri) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture " + name);
            return Jsoup.parse(in, "UTF-8", baseUri);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
