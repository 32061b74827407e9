package com.flightphotos.scraper.source;

import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.model.ScrapedPhoto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * jetphotos.com registration pages.
 *
 * URL: https://www.jetphotos.com/registration/{REG without dashes}
 * One page holds every photo of the airframe, each as a .result[data-photo] card.
 * "No results" is an explicit .result__noResults block. A page with neither cards
 * nor that block is treated as a layout change.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JetPhotosAdapter implements PhotoSourceAdapter {

    static final String BASE_URL = "https://www.jetphotos.com";

    private static final Pattern ICAO = Pattern.compile("- ([A-Z]{4})(?:,|\\s|$)");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final HtmlPageFetcher fetcher;

    @Override
    public PhotoSource source() {
        return PhotoSource.JETPHOTOS;
    }

    @Override
    public List<ScrapedPhoto> search(String registration, Set<String> airportHints) {
        String url = BASE_URL + "/registration/" + registration.replace("-", "").toUpperCase();
        Document page = fetcher.get(source(), url);

        List<ScrapedPhoto> photos = parse(page, registration);
        log.info("JetPhotos: found {} photos for {}", photos.size(), registration);
        return photos;
    }

    List<ScrapedPhoto> parse(Document page, String registration) {
        List<Element> cards = page.select(".result[data-photo]");
        if (cards.isEmpty()) {
            if (page.selectFirst(".result__noResults") != null || page.text().contains("No photos found")) {
                throw new NoResultsException(source().key(), registration);
            }
            throw new StructuralParseException(source().key(),
                    "No photo cards and no empty-result marker on " + page.location());
        }

        List<ScrapedPhoto> photos = new ArrayList<>();
        for (Element card : cards) {
            try {
                ScrapedPhoto photo = parseCard(card, registration);
                if (photo != null) photos.add(photo);
            } catch (RuntimeException e) {
                log.debug("Failed to parse JetPhotos card: {}", e.getMessage());
            }
        }

        if (photos.isEmpty()) {
            throw new StructuralParseException(source().key(),
                    cards.size() + " photo cards found but none could be parsed");
        }
        return photos;
    }

    private ScrapedPhoto parseCard(Element card, String registration) {
        String photoId = card.attr("data-photo");
        if (photoId.isBlank()) return null;

        String thumbnail = null;
        Element img = card.selectFirst(".result__photo");
        if (img != null) {
            String src = img.attr("src");
            if (src.startsWith("//")) src = "https:" + src;
            if (src.contains("cdn.jetphotos.com")) thumbnail = src;
        }

        Element photographerLink = card.selectFirst(".result__infoListText--photographer a");

        LocalDate photoDate = null;
        for (Element li : card.select(".desktop-only.desktop-only--block li")) {
            String text = li.text();
            if (text.startsWith("Photo date:")) {
                photoDate = parseIsoDate(text);
            }
        }

        String airportCode = null;
        for (Element li : card.select(".result__section--info2-wrapper li")) {
            String text = li.text();
            if (text.startsWith("Location:")) {
                Matcher m = ICAO.matcher(text);
                if (m.find()) airportCode = m.group(1);
            }
        }

        return ScrapedPhoto.builder()
                .source(source().key())
                .sourcePhotoId(photoId)
                .sourceUrl(BASE_URL + "/photo/" + photoId)
                .thumbnailUrl(thumbnail)
                .registration(registration)
                .airportCode(airportCode)
                .photoDate(photoDate)
                .photographer(photographerLink != null ? photographerLink.text().trim() : null)
                .build();
    }

    private LocalDate parseIsoDate(String text) {
        Matcher m = ISO_DATE.matcher(text);
        if (!m.find()) return null;
        try {
            return LocalDate.parse(m.group());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
