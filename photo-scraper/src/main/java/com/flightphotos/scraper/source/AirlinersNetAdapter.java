package com.flightphotos.scraper.source;

import com.flightphotos.scraper.config.FlightPhotoProperties;
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
 * airliners.net search results, paged.
 *
 * URL: https://www.airliners.net/search?registrationActual={REG}&page={n}
 * Each result row is a .ps-v2-results-display-detail-col. An empty first page is
 * only "no results" when the site renders its .ps-v2-results-no-results notice.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AirlinersNetAdapter implements PhotoSourceAdapter {

    static final String BASE_URL = "https://www.airliners.net";

    private static final Pattern DATE = Pattern.compile(
            "(January|February|March|April|May|June|July|August|September|October|November|December)"
                    + "\\s+(\\d{1,2}),?\\s*(\\d{4})");
    private static final Pattern AIRPORT = Pattern.compile("\\(([A-Z]{3})\\s*/\\s*[A-Z]{4}\\)");
    private static final Pattern PHOTO_ID = Pattern.compile("/(\\d+)(?:\\?|$)");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d yyyy", Locale.ENGLISH);

    private final HtmlPageFetcher fetcher;
    private final FlightPhotoProperties properties;

    @Override
    public PhotoSource source() {
        return PhotoSource.AIRLINERS_NET;
    }

    @Override
    public List<ScrapedPhoto> search(String registration, Set<String> airportHints) {
        int maxPages = properties.sourceFor(source().key()).getMaxPages();
        List<ScrapedPhoto> photos = new ArrayList<>();

        for (int page = 1; page <= maxPages; page++) {
            String url = BASE_URL + "/search?registrationActual=" + registration + "&page=" + page;
            Document doc = fetcher.get(source(), url);

            List<Element> rows = doc.select(".ps-v2-results-display-detail-col");
            if (rows.isEmpty()) {
                if (page == 1) checkEmptyFirstPage(doc, registration);
                break;
            }

            photos.addAll(parseRows(rows, registration));

            if (!hasNextPage(doc)) break;
        }

        if (photos.isEmpty()) {
            throw new StructuralParseException(source().key(), "Result rows found but none could be parsed");
        }
        log.info("Airliners.net: found {} photos for {}", photos.size(), registration);
        return photos;
    }

    void checkEmptyFirstPage(Document doc, String registration) {
        if (doc.selectFirst(".ps-v2-results-no-results") != null || doc.text().contains("No results")) {
            throw new NoResultsException(source().key(), registration);
        }
        throw new StructuralParseException(source().key(),
                "No result rows and no empty-result notice on " + doc.location());
    }

    boolean hasNextPage(Document doc) {
        return doc.selectFirst("a[rel=next]") != null
                || doc.selectFirst(".ps-v2-results-pagination-next a") != null;
    }

    List<ScrapedPhoto> parseRows(List<Element> rows, String registration) {
        List<ScrapedPhoto> photos = new ArrayList<>();
        for (Element row : rows) {
            try {
                ScrapedPhoto photo = parseRow(row, registration);
                if (photo != null) photos.add(photo);
            } catch (RuntimeException e) {
                log.debug("Failed to parse airliners.net row: {}", e.getMessage());
            }
        }
        return photos;
    }

    private ScrapedPhoto parseRow(Element row, String registration) {
        Element link = row.selectFirst("a[href*='/photo/']");
        if (link == null) return null;

        String href = link.attr("href");
        Matcher idMatch = PHOTO_ID.matcher(href);
        if (!idMatch.find()) return null;
        String photoId = idMatch.group(1);

        String cleanHref = href.split("\\?")[0];
        if (!cleanHref.startsWith("http")) cleanHref = BASE_URL + cleanHref;

        Element img = row.selectFirst("img[src*=imgproc]");
        if (img == null) img = row.selectFirst("img[data-src*=imgproc]");
        String thumbnail = null;
        if (img != null) {
            thumbnail = img.hasAttr("src") && !img.attr("src").isBlank() ? img.attr("src") : img.attr("data-src");
        }

        String airportCode = null;
        LocalDate photoDate = null;
        String photographer = null;

        for (Element col : row.select(".ps-v2-results-col")) {
            String text = col.text();

            Matcher airport = AIRPORT.matcher(text);
            if (text.contains("Location") || airport.find()) {
                airport.reset();
                if (airport.find()) airportCode = airport.group(1);

                Matcher date = DATE.matcher(text);
                if (date.find()) photoDate = parseDate(date);
            }

            if (text.contains("Photographer")) {
                String name = text.replace("Photographer", "").trim();
                if (!name.isEmpty()) photographer = name;
            }
        }

        return ScrapedPhoto.builder()
                .source(source().key())
                .sourcePhotoId(photoId)
                .sourceUrl(cleanHref)
                .thumbnailUrl(thumbnail)
                .fullImageUrl(fullImage(thumbnail))
                .registration(registration)
                .airportCode(airportCode)
                .photoDate(photoDate)
                .photographer(photographer)
                .build();
    }

    /** Thumbnails end in -N.jpg, the -0 variant is the full-size image */
    private String fullImage(String thumbnail) {
        if (thumbnail == null || thumbnail.isBlank()) return null;
        return thumbnail.split("\\?")[0].replaceAll("-\\d\\.jpg$", "-0.jpg");
    }

    private LocalDate parseDate(Matcher m) {
        try {
            return LocalDate.parse(m.group(1) + " " + m.group(2) + " " + m.group(3), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
