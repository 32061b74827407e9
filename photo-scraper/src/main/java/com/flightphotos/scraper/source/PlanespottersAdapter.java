package com.flightphotos.scraper.source;

import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.model.ScrapedPhoto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * planespotters.net registration galleries.
 *
 * URL: https://www.planespotters.net/photos/reg/{REG}
 * Cards are .photo-card-clickable. Dates are split over day/month/year links,
 * some photos only carry month and year (we take the 1st of the month then).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PlanespottersAdapter implements PhotoSourceAdapter {

    static final String BASE_URL = "https://www.planespotters.net";

    private static final Pattern AIRPORT = Pattern.compile("\\(([A-Z]{3})\\s*/\\s*([A-Z]{4})\\)");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH);

    private final HtmlPageFetcher fetcher;

    @Override
    public PhotoSource source() {
        return PhotoSource.PLANESPOTTERS;
    }

    @Override
    public List<ScrapedPhoto> search(String registration, Set<String> airportHints) {
        Document page = fetcher.get(source(), BASE_URL + "/photos/reg/" + registration);
        List<ScrapedPhoto> photos = parse(page, registration);
        log.info("Planespotters: found {} photos for {}", photos.size(), registration);
        return photos;
    }

    List<ScrapedPhoto> parse(Document page, String registration) {
        List<Element> cards = page.select(".photo-card-clickable");
        if (cards.isEmpty()) {
            if (page.selectFirst(".photo-gallery-empty") != null
                    || page.text().contains("No photos found")) {
                throw new NoResultsException(source().key(), registration);
            }
            throw new StructuralParseException(source().key(),
                    "No photo cards and no empty-gallery marker on " + page.location());
        }

        List<ScrapedPhoto> photos = new ArrayList<>();
        for (Element card : cards) {
            try {
                ScrapedPhoto photo = parseCard(card, registration);
                if (photo != null) photos.add(photo);
            } catch (RuntimeException e) {
                log.debug("Failed to parse Planespotters card: {}", e.getMessage());
            }
        }

        if (photos.isEmpty()) {
            throw new StructuralParseException(source().key(),
                    cards.size() + " photo cards found but none could be parsed");
        }
        return photos;
    }

    private ScrapedPhoto parseCard(Element card, String registration) {
        String photoId = card.id();
        if (photoId.isBlank()) return null;

        String path = card.attr("data-photo-url").split("\\?")[0];
        String sourceUrl = path.isBlank() ? BASE_URL + "/photo/" + photoId : BASE_URL + path;

        Element img = card.selectFirst("img");
        Element photographerSpan = card.selectFirst(".drop-shadow-lg");

        return ScrapedPhoto.builder()
                .source(source().key())
                .sourcePhotoId(photoId)
                .sourceUrl(sourceUrl)
                .thumbnailUrl(img != null ? img.attr("src") : null)
                .registration(registration)
                .airportCode(parseAirport(card))
                .photoDate(parseDate(card))
                .photographer(photographerSpan != null
                        ? photographerSpan.text().replace("©", "").trim()
                        : null)
                .build();
    }

    private String parseAirport(Element card) {
        Element link = card.selectFirst("a[href*=/photos/airport/]");
        if (link == null) return null;

        Matcher m = AIRPORT.matcher(link.attr("title"));
        if (m.find()) return m.group(1);
        m = AIRPORT.matcher(link.text());
        return m.find() ? m.group(1) : null;
    }

    private LocalDate parseDate(Element card) {
        List<Element> parts = card.select("a[href*=/photos/date/]");
        String text;
        if (parts.size() >= 3) {
            text = parts.get(0).text() + " " + parts.get(1).text() + " " + parts.get(2).text();
        } else if (parts.size() == 2) {
            text = "1 " + parts.get(0).text() + " " + parts.get(1).text();
        } else {
            return null;
        }
        try {
            return LocalDate.parse(text.trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
