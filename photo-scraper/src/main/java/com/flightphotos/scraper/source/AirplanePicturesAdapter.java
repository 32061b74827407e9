package com.flightphotos.scraper.source;

import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.model.ScrapedPhoto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * airplane-pictures.net, the one source that filters by airport server-side.
 *
 * POST https://airplane-pictures.net/search with apreg plus apiata or apicao,
 * once per airport hint. Result cards only carry a link, so every photo costs an
 * extra detail-page request for date, airport and photographer.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AirplanePicturesAdapter implements PhotoSourceAdapter {

    static final String BASE_URL = "https://airplane-pictures.net";

    private static final Pattern ONCLICK_URL = Pattern.compile("location\\.href='([^']+)'");
    private static final Pattern PHOTO_ID = Pattern.compile("/photo/(\\d+)");
    private static final Pattern TAKEN = Pattern.compile("(\\d{1,2})\\.(\\d{2})\\.(\\d{4})");
    private static final Pattern IATA = Pattern.compile("\\b([A-Z]{3})\\b");
    private static final Pattern ICAO = Pattern.compile("\\b([A-Z]{4})\\b");

    private final HtmlPageFetcher fetcher;

    @Override
    public PhotoSource source() {
        return PhotoSource.AIRPLANE_PICTURES;
    }

    @Override
    public List<ScrapedPhoto> search(String registration, Set<String> airportHints) {
        Map<String, String> detailUrls = new LinkedHashMap<>();
        boolean sawEmptyMarker = false;
        boolean sawUnknownPage = false;

        for (Map<String, String> form : searchForms(registration, airportHints)) {
            Document page = fetcher.postForm(source(), BASE_URL + "/search", form);
            List<Element> cards = page.select(".card.ap-card");
            if (cards.isEmpty()) {
                if (isEmptyResult(page)) sawEmptyMarker = true;
                else sawUnknownPage = true;
                continue;
            }
            detailUrls.putAll(parseSearchResults(page));
        }

        if (detailUrls.isEmpty()) {
            if (sawUnknownPage && !sawEmptyMarker) {
                throw new StructuralParseException(source().key(),
                        "Search returned neither result cards nor an empty-result notice");
            }
            throw new NoResultsException(source().key(), registration);
        }

        List<ScrapedPhoto> photos = new ArrayList<>();
        for (Map.Entry<String, String> entry : detailUrls.entrySet()) {
            try {
                Document detail = fetcher.get(source(), entry.getValue());
                photos.add(parseDetail(detail, entry.getKey(), entry.getValue(), registration));
            } catch (NoResultsException | StructuralParseException e) {
                log.debug("Skipping airplane-pictures photo {}: {}", entry.getKey(), e.getMessage());
            }
        }

        if (photos.isEmpty()) {
            throw new StructuralParseException(source().key(),
                    detailUrls.size() + " results found but no detail page could be read");
        }
        log.info("Airplane-pictures: found {} photos for {}", photos.size(), registration);
        return photos;
    }

    List<Map<String, String>> searchForms(String registration, Set<String> airportHints) {
        Set<String> hints = new LinkedHashSet<>();
        if (airportHints != null) {
            for (String hint : airportHints) {
                if (hint != null && (hint.trim().length() == 3 || hint.trim().length() == 4)) {
                    hints.add(hint.trim().toUpperCase());
                }
            }
        }

        List<Map<String, String>> forms = new ArrayList<>();
        if (hints.isEmpty()) {
            forms.add(Map.of("apreg", registration));
            return forms;
        }
        for (String hint : hints) {
            forms.add(Map.of("apreg", registration, hint.length() == 3 ? "apiata" : "apicao", hint));
        }
        return forms;
    }

    boolean isEmptyResult(Document page) {
        return page.selectFirst(".no-results") != null
                || page.text().contains("No results")
                || page.text().contains("No photos found");
    }

    /** Photo id to absolute detail URL, de-duplicated */
    Map<String, String> parseSearchResults(Document page) {
        Map<String, String> results = new LinkedHashMap<>();
        for (Element card : page.select(".card.ap-card")) {
            String href = null;
            Matcher onclick = ONCLICK_URL.matcher(card.attr("onclick"));
            if (onclick.find()) {
                href = onclick.group(1);
            } else {
                Element link = card.selectFirst("a[href*=/photo/]");
                if (link != null) href = link.attr("href");
            }
            if (href == null) continue;

            Matcher id = PHOTO_ID.matcher(href);
            if (!id.find()) continue;
            results.putIfAbsent(id.group(1), href.startsWith("http") ? href : BASE_URL + href);
        }
        return results;
    }

    ScrapedPhoto parseDetail(Document detail, String photoId, String detailUrl, String registration) {
        LocalDate photoDate = null;
        String iata = null;
        String icao = null;
        String photographer = null;

        for (Element row : detail.select("tr")) {
            List<Element> cells = row.select("td");
            if (cells.size() < 2) continue;
            String label = cells.get(0).text().toLowerCase();
            String value = cells.get(1).text().trim();

            if (label.contains("taken")) {
                photoDate = parseTaken(value);
            } else if (label.contains("iata")) {
                Matcher m = IATA.matcher(value);
                if (m.find()) iata = m.group(1);
            } else if (label.contains("icao")) {
                Matcher m = ICAO.matcher(value);
                if (m.find()) icao = m.group(1);
            } else if (label.contains("photographer") && !value.isEmpty()) {
                photographer = value;
            }
        }

        Element img = detail.selectFirst("img[src*=/images/uploaded-images/]");
        String imageUrl = null;
        if (img != null) {
            imageUrl = img.attr("src");
            if (!imageUrl.startsWith("http")) imageUrl = BASE_URL + imageUrl;
        }

        return ScrapedPhoto.builder()
                .source(source().key())
                .sourcePhotoId(photoId)
                .sourceUrl(detailUrl)
                .thumbnailUrl(imageUrl)
                .fullImageUrl(imageUrl)
                .registration(registration)
                .airportCode(icao != null ? icao : iata)
                .photoDate(photoDate)
                .photographer(photographer)
                .build();
    }

    private LocalDate parseTaken(String value) {
        Matcher m = TAKEN.matcher(value);
        if (!m.find()) return null;
        try {
            return LocalDate.of(Integer.parseInt(m.group(3)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
