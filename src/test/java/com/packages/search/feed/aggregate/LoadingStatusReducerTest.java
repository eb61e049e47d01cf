package com.packages.search.feed.aggregate;

import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.SearchResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.packages.search.model.LoadingStatus.CANCELLED;
import static com.packages.search.model.LoadingStatus.ERROR_OCCURRED;
import static com.packages.search.model.LoadingStatus.LOADING;
import static com.packages.search.model.LoadingStatus.NO_MORE_ITEMS;
import static com.packages.search.model.LoadingStatus.READY;
import static com.packages.search.model.LoadingStatus.UNKNOWN;
import static org.assertj.core.api.Assertions.assertThat;

class LoadingStatusReducerTest {

    @Test
    void emptyMapIsUnknown() {
        assertThat(LoadingStatusReducer.reduce(Map.of())).isEqualTo(UNKNOWN);
    }

    @Test
    void allSourcesExhaustedIsNoMoreItems() {
        assertThat(LoadingStatusReducer.reduce(Map.of("a", NO_MORE_ITEMS, "b", NO_MORE_ITEMS)))
                .isEqualTo(NO_MORE_ITEMS);
    }

    @Test
    void oneSourceWithMorePagesKeepsCompositeReady() {
        assertThat(LoadingStatusReducer.reduce(Map.of("a", NO_MORE_ITEMS, "b", READY)))
                .isEqualTo(READY);
    }

    @Test
    void loadingWinsOverReady() {
        assertThat(LoadingStatusReducer.reduce(List.of(READY, LOADING, NO_MORE_ITEMS))).isEqualTo(LOADING);
    }

    @Test
    void partialFailureDegradesToSurvivors() {
        assertThat(LoadingStatusReducer.reduce(Map.of("a", ERROR_OCCURRED, "b", NO_MORE_ITEMS)))
                .isEqualTo(NO_MORE_ITEMS);
        assertThat(LoadingStatusReducer.reduce(Map.of("a", ERROR_OCCURRED, "b", READY)))
                .isEqualTo(READY);
    }

    @Test
    void everySourceFailedIsError() {
        assertThat(LoadingStatusReducer.reduce(Map.of("a", ERROR_OCCURRED, "b", ERROR_OCCURRED)))
                .isEqualTo(ERROR_OCCURRED);
    }

    @Test
    void cancelledOnlyWhenNothingBetterIsAvailable() {
        assertThat(LoadingStatusReducer.reduce(List.of(CANCELLED, CANCELLED))).isEqualTo(CANCELLED);
        assertThat(LoadingStatusReducer.reduce(List.of(CANCELLED, ERROR_OCCURRED))).isEqualTo(CANCELLED);
        assertThat(LoadingStatusReducer.reduce(List.of(CANCELLED, NO_MORE_ITEMS))).isEqualTo(NO_MORE_ITEMS);
    }

    @Test
    void unreportedSourceRanksBelowEveryOtherSurvivor() {
        assertThat(LoadingStatusReducer.reduce(List.of(ERROR_OCCURRED, UNKNOWN))).isEqualTo(UNKNOWN);
        assertThat(LoadingStatusReducer.reduce(List.of(UNKNOWN, CANCELLED))).isEqualTo(CANCELLED);
        assertThat(LoadingStatusReducer.reduce(List.of(UNKNOWN, NO_MORE_ITEMS))).isEqualTo(NO_MORE_ITEMS);
    }

    @Test
    void pageWithoutStatusesIsJudgedByItsContinuation() {
        SearchResult<String> last = SearchResult.fromItems("x");
        SearchResult<String> more = last.toBuilder().nextToken(new ContinuationToken() { }).build();

        assertThat(LoadingStatusReducer.reduce(last)).isEqualTo(LoadingStatus.NO_MORE_ITEMS);
        assertThat(LoadingStatusReducer.reduce(more)).isEqualTo(LoadingStatus.READY);
    }
}
