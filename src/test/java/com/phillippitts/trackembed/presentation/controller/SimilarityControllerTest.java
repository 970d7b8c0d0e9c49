package com.phillippitts.trackembed.presentation.controller;

import com.phillippitts.trackembed.domain.EmbeddingRecord;
import com.phillippitts.trackembed.domain.SimilarTrack;
import com.phillippitts.trackembed.exception.EmbeddingNotFoundException;
import com.phillippitts.trackembed.presentation.dto.SimilarTrackResponse;
import com.phillippitts.trackembed.service.index.VectorIndexClient;
import com.phillippitts.trackembed.service.index.VectorIndexClientProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SimilarityControllerTest {

    private static final float[] VECTOR = {0.1f, 0.2f, 0.3f, 0.4f};

    private VectorIndexClientProvider provider;
    private VectorIndexClient client;
    private SimilarityController controller;

    @BeforeEach
    void setUp() {
        provider = mock(VectorIndexClientProvider.class);
        client = mock(VectorIndexClient.class);
        when(provider.get()).thenReturn(client);
        controller = new SimilarityController(provider);
    }

    @Test
    void similarExcludesTheQueriedTrack() {
        when(client.getEmbedding("t1")).thenReturn(Optional.of(new EmbeddingRecord("t1", VECTOR, Map.of())));
        when(client.searchSimilar(VECTOR, 3, 0.7)).thenReturn(List.of(
                new SimilarTrack("t1", 1.0, Map.of()),
                new SimilarTrack("t2", 0.93, Map.of("name", "Two")),
                new SimilarTrack("t3", 0.81, Map.of("name", "Three"))));

        ResponseEntity<List<SimilarTrackResponse>> response = controller.similar("t1", 2, 0.7);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).extracting(SimilarTrackResponse::trackId).containsExactly("t2", "t3");
        assertThat(response.getBody().get(0).metadata()).containsEntry("name", "Two");
    }

    @Test
    void similarTruncatesToLimitWhenSelfIsAbsent() {
        when(client.getEmbedding("t1")).thenReturn(Optional.of(new EmbeddingRecord("t1", VECTOR, Map.of())));
        when(client.searchSimilar(eq(VECTOR), eq(2), anyDouble())).thenReturn(List.of(
                new SimilarTrack("t2", 0.9, Map.of()),
                new SimilarTrack("t3", 0.8, Map.of())));

        assertThat(controller.similar("t1", 1, 0.5).getBody()).extracting(SimilarTrackResponse::trackId)
                .containsExactly("t2");
    }

    @Test
    void similarForUnknownTrackIsNotFound() {
        when(client.getEmbedding("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.similar("nope", 10, 0.7))
                .isInstanceOf(EmbeddingNotFoundException.class);
    }

    @Test
    void rejectsOutOfRangeParameters() {
        assertThatThrownBy(() -> controller.similar("t1", 0, 0.7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.similar("t1", 101, 0.7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> controller.similar("t1", 10, 1.5)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(provider);
    }

    @Test
    void existsReportsPresence() {
        when(client.hasEmbedding("t1")).thenReturn(true);

        assertThat(controller.exists("t1").getBody()).containsEntry("track_id", "t1").containsEntry("exists", true);
    }

    @Test
    void deleteReports200OnSuccessAnd503OnFailure() {
        when(client.deleteEmbedding("t1")).thenReturn(true);
        when(client.deleteEmbedding("t2")).thenReturn(false);

        ResponseEntity<Map<String, Object>> ok = controller.delete("t1");
        ResponseEntity<Map<String, Object>> failed = controller.delete("t2");

        assertThat(ok.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(ok.getBody()).containsEntry("deleted", true);
        assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(failed.getBody()).containsEntry("deleted", false);
        verify(client).deleteEmbedding("t2");
    }

    @Test
    void searchIsNotAttemptedWithoutStoredVector() {
        when(client.getEmbedding("t9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.similar("t9", 5, 0.0)).isInstanceOf(EmbeddingNotFoundException.class);
        verify(client, never()).searchSimilar(any(float[].class), anyInt(), anyDouble());
    }
}
