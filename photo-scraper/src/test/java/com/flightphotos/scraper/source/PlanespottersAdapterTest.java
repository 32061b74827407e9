package com.flightphotos.scraper.source;

import com.flightphotos.scraper.model.ScrapedPhoto;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class PlanespottersAdapterTest {

    private static final String PAGE_URL = "https://www.planespotters.net/photos/reg/G-XLEA";

    private final PlanespottersAdapter adapter = new PlanespottersAdapter(mock(HtmlPageFetcher.class));

    @Test
    void parsesPhotoCards() {
        List<ScrapedPhoto> photos = adapter.parse(Fixtures.html("planespotters-results.html", PAGE_URL), "G-XLEA");

        assertThat(photos).hasSize(2);
        ScrapedPhoto first = photos.get(0);
        assertThat(first.getSourcePhotoId()).isEqualTo("1498765");
        assertThat(first.getSourceUrl())
                .isEqualTo("https://www.planespotters.net/photo/1498765/g-xlea-british-airways-airbus-a380-841");
        assertThat(first.getThumbnailUrl()).isEqualTo("https://t.plnspttrs.net/12345/1498765_3f9a1b_280.jpg");
        assertThat(first.getPhotographer()).isEqualTo("Alex Photog");
        assertThat(first.getAirportCode()).isEqualTo("LHR");
        assertThat(first.getPhotoDate()).isEqualTo(LocalDate.of(2024, 3, 2));
    }

    @Test
    void monthOnlyDateFallsOnTheFirst() {
        ScrapedPhoto second = adapter.parse(Fixtures.html("planespotters-results.html", PAGE_URL), "G-XLEA").get(1);

        assertThat(second.getPhotoDate()).isEqualTo(LocalDate.of(2023, 11, 1));
        assertThat(second.getAirportCode()).isNull();
    }

    @Test
    void emptyGalleryAndUnknownPagesAreToldApart() {
        assertThatThrownBy(() -> adapter.parse(Fixtures.html("planespotters-empty.html", PAGE_URL), "G-XLEA"))
                .isInstanceOf(NoResultsException.class);
        assertThatThrownBy(() -> adapter.parse(Fixtures.html("challenge-page.html", PAGE_URL), "G-XLEA"))
                .isInstanceOf(StructuralParseException.class);
    }
}
