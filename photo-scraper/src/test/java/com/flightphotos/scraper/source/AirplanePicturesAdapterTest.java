package com.flightphotos.scraper.source;

import com.flightphotos.scraper.model.PhotoSource;
import com.flightphotos.scraper.model.ScrapedPhoto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AirplanePicturesAdapterTest {

    private static final String SEARCH_URL = "https://airplane-pictures.net/search";
    private static final String DETAIL_URL =
            "https://airplane-pictures.net/photo/998877/g-xlea-british-airways-airbus-a380-841/";

    private HtmlPageFetcher fetcher;
    private AirplanePicturesAdapter adapter;

    @BeforeEach
    void setUp() {
        fetcher = mock(HtmlPageFetcher.class);
        adapter = new AirplanePicturesAdapter(fetcher);
    }

    @Test
    void searchesOncePerAirportHintWithTheMatchingCodeField() {
        List<Map<String, String>> forms = adapter.searchForms("G-XLEA", new LinkedHashSet<>(List.of("LHR", "KJFK")));

        assertThat(forms).containsExactly(
                Map.of("apreg", "G-XLEA", "apiata", "LHR"),
                Map.of("apreg", "G-XLEA", "apicao", "KJFK"));
        assertThat(adapter.searchForms("G-XLEA", Set.of())).containsExactly(Map.of("apreg", "G-XLEA"));
    }

    @Test
    void deduplicatesResultsAcrossSearches() {
        Map<String, String> results = adapter.parseSearchResults(
                Fixtures.html("airplane-pictures-search.html", SEARCH_URL));

        assertThat(results).containsOnlyKeys("998877", "998878");
        assertThat(results.get("998878"))
                .isEqualTo("https://airplane-pictures.net/photo/998878/g-xlea-british-airways-airbus-a380-841/");
    }

    @Test
    void parsesTheDetailPage() {
        ScrapedPhoto photo = adapter.parseDetail(
                Fixtures.html("airplane-pictures-detail.html", DETAIL_URL), "998877", DETAIL_URL, "G-XLEA");

        assertThat(photo.getPhotoDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(photo.getAirportCode()).isEqualTo("EGLL");
        assertThat(photo.getPhotographer()).isEqualTo("Pat Lens");
        assertThat(photo.getFullImageUrl()).isEqualTo("https://airplane-pictures.net/images/uploaded-images/2024-3/998877.jpg");
        assertThat(photo.getSourceUrl()).isEqualTo(DETAIL_URL);
    }

    @Test
    void missingDetailPagesAreSkipped() {
        when(fetcher.postForm(eq(PhotoSource.AIRPLANE_PICTURES), anyString(), anyMap()))
                .thenReturn(Fixtures.html("airplane-pictures-search.html", SEARCH_URL));
        when(fetcher.get(eq(PhotoSource.AIRPLANE_PICTURES), contains("998877")))
                .thenReturn(Fixtures.html("airplane-pictures-detail.html", DETAIL_URL));
        when(fetcher.get(eq(PhotoSource.AIRPLANE_PICTURES), contains("998878")))
                .thenThrow(new NoResultsException("airplane_pictures", "998878"));

        List<ScrapedPhoto> photos = adapter.search("G-XLEA", new LinkedHashSet<>(List.of("LHR", "KJFK")));

        assertThat(photos).extracting(ScrapedPhoto::getSourcePhotoId).containsExactly("998877");
        verify(fetcher).postForm(PhotoSource.AIRPLANE_PICTURES, SEARCH_URL, Map.of("apreg", "G-XLEA", "apiata", "LHR"));
        verify(fetcher).postForm(PhotoSource.AIRPLANE_PICTURES, SEARCH_URL, Map.of("apreg", "G-XLEA", "apicao", "KJFK"));
    }

    @Test
    void emptySearchIsNoResultsAndAnUnknownPageIsStructural() {
        when(fetcher.postForm(eq(PhotoSource.AIRPLANE_PICTURES), anyString(), anyMap()))
                .thenReturn(Fixtures.html("airplane-pictures-empty.html", SEARCH_URL));
        assertThatThrownBy(() -> adapter.search("G-XLEA", Set.of())).isInstanceOf(NoResultsException.class);

        when(fetcher.postForm(eq(PhotoSource.AIRPLANE_PICTURES), anyString(), anyMap()))
                .thenReturn(Fixtures.html("challenge-page.html", SEARCH_URL));
        assertThatThrownBy(() -> adapter.search("G-XLEA", Set.of())).isInstanceOf(StructuralParseException.class);
    }
}
