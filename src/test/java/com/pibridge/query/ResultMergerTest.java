package com.pibridge.query;

import com.pibridge.domain.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResultMerger Tests")
class ResultMergerTest {

    private ResultMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ResultMerger();
    }

    // ========== Merge ==========

    @Test
    @DisplayName("Should merge legs newest first and number them 1..N")
    void shouldMergeDeterministically() {
        // Given
        List<Sample> instant = List.of(new Sample("T", "2025-01-01T10:00:00", 1.0));
        List<Sample> historical = List.of(
            new Sample("T", "2025-01-01T09:00:00", 2.0),
            new Sample("T", "2025-01-01T09:30:00", 3.0));

        // When
        List<Sample> merged = merger.merge(instant, historical, 3);

        // Then
        assertThat(merged).containsExactly(
            new Sample(1, "T", "2025-01-01T10:00:00", 1.0),
            new Sample(2, "T", "2025-01-01T09:30:00", 3.0),
            new Sample(3, "T", "2025-01-01T09:00:00", 2.0));
    }

    @Test
    @DisplayName("Should give the same result regardless of leg completion order")
    void shouldNotDependOnInputOrder() {
        List<Sample> historical = List.of(
            new Sample("T", "2025-01-01T09:30:00", 3.0),
            new Sample("T", "2025-01-01T09:00:00", 2.0));
        List<Sample> reversed = List.of(historical.get(1), historical.get(0));

        assertThat(merger.merge(List.of(), historical, 5)).isEqualTo(merger.merge(List.of(), reversed, 5));
    }

    @Test
    @DisplayName("Should truncate to the total limit after sorting")
    void shouldTruncateAfterSorting() {
        List<Sample> historical = List.of(
            new Sample("T", "2025-01-01T08:00:00Z", 1.0),
            new Sample("T", "2025-01-01T11:00:00Z", 4.0),
            new Sample("T", "2025-01-01T09:00:00Z", 2.0),
            new Sample("T", "2025-01-01T10:00:00Z", 3.0));

        List<Sample> merged = merger.merge(List.of(), historical, 2);

        assertThat(merged).extracting(Sample::getValue).containsExactly(4.0, 3.0);
        assertThat(merged).extracting(Sample::getId).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should keep instant samples ahead of historical ones with the same timestamp")
    void shouldBeStableForEqualTimestamps() {
        List<Sample> instant = List.of(new Sample("T", "2025-01-01T10:00:00Z", "instant"));
        List<Sample> historical = List.of(new Sample("T", "2025-01-01T10:00:00Z", "historical"));

        List<Sample> merged = merger.merge(instant, historical, 10);

        assertThat(merged).extracting(Sample::getValue).containsExactly("instant", "historical");
    }

    @Test
    @DisplayName("Should compare mixed timestamp formats as instants")
    void shouldCompareMixedFormatsAsInstants() {
        List<Sample> samples = List.of(
            new Sample("T", "2025-01-01 09:00:00", 1.0),
            new Sample("T", "2025-01-01T16:30:00+07:00", 2.0),
            new Sample("T", "2025-01-01T10:00:00Z", 3.0));

        assertThat(merger.postProcess(samples, null)).extracting(Sample::getValue).containsExactly(3.0, 2.0, 1.0);
    }

    @Test
    @DisplayName("Should place unreadable timestamps after readable ones")
    void shouldSortUnreadableTimestampsLast() {
        List<Sample> samples = List.of(
            new Sample("T", "bad-a", 1.0),
            new Sample("T", "2025-01-01T10:00:00Z", 2.0),
            new Sample("T", "bad-b", 3.0));

        assertThat(merger.postProcess(samples, null)).extracting(Sample::getTimestamp)
            .containsExactly("2025-01-01T10:00:00Z", "bad-b", "bad-a");
    }

    @Test
    @DisplayName("Should keep everything when no limit is known")
    void shouldKeepAllWithoutLimit() {
        List<Sample> samples = List.of(new Sample("T", "2025-01-01T09:00:00Z", 1.0),
            new Sample("T", "2025-01-01T10:00:00Z", 2.0));

        assertThat(merger.postProcess(samples, null)).extracting(Sample::getId).containsExactly(1, 2);
        assertThat(merger.postProcess(samples, null)).hasSize(2);
    }

    // ========== Filter ==========

    @Test
    @DisplayName("Should apply value predicates and exclude non-numeric values")
    void shouldFilterByValue() {
        WhereConditions where = new WhereConditions();
        where.setValueGt(10.0);
        where.setValueLt(50.0);
        List<Sample> samples = List.of(
            new Sample("T", "t1", 5.0),
            new Sample("T", "t2", 20.0),
            new Sample("T", "t3", "Shutdown"),
            new Sample("T", "t4", 50.0));

        assertThat(merger.filter(samples, where)).extracting(Sample::getValue).containsExactly(20.0);
    }

    @Test
    @DisplayName("Should apply inclusive value BETWEEN")
    void shouldFilterByValueBetween() {
        WhereConditions where = new WhereConditions();
        where.setValueBetween(new WhereConditions.Bounds<>(1.0, 2.0));
        List<Sample> samples = List.of(new Sample("T", "t", 1.0), new Sample("T", "t", 2.5));

        assertThat(merger.filter(samples, where)).extracting(Sample::getValue).containsExactly(1.0);
    }

    @Test
    @DisplayName("Should apply absolute timestamp bounds")
    void shouldFilterByTimestamp() {
        WhereConditions where = new WhereConditions();
        where.setTimestampBetween(new WhereConditions.Bounds<>("2025-01-01T09:00:00", "2025-01-01T10:00:00"));
        List<Sample> samples = List.of(
            new Sample("T", "2025-01-01T08:59:59Z", 1.0),
            new Sample("T", "2025-01-01T09:00:00Z", 2.0),
            new Sample("T", "2025-01-01T10:00:00Z", 3.0),
            new Sample("T", "2025-01-01T10:00:01Z", 4.0));

        assertThat(merger.filter(samples, where)).extracting(Sample::getValue).containsExactly(2.0, 3.0);
    }

    @Test
    @DisplayName("Should leave relative timestamp bounds to the historian")
    void shouldIgnoreRelativeBounds() {
        WhereConditions where = new WhereConditions();
        where.setTimestampGte("*-1h");
        List<Sample> samples = List.of(new Sample("T", "2020-01-01T00:00:00Z", 1.0));

        assertThat(merger.filter(samples, where)).hasSize(1);
    }

    @Test
    @DisplayName("Should apply tag equality, membership and LIKE patterns")
    void shouldFilterByTag() {
        List<Sample> samples = List.of(
            new Sample("PUMP.01", "t", 1.0),
            new Sample("VALVE.01", "t", 2.0),
            new Sample("pump.02", "t", 3.0));

        WhereConditions like = new WhereConditions();
        like.setTagLike("PUMP%");
        assertThat(merger.filter(samples, like)).extracting(Sample::getValue).containsExactly(1.0, 3.0);

        WhereConditions in = new WhereConditions();
        in.setTagIn(List.of("VALVE.01", "OTHER"));
        assertThat(merger.filter(samples, in)).extracting(Sample::getValue).containsExactly(2.0);

        WhereConditions eq = new WhereConditions();
        eq.setTagEq("pump.01");
        assertThat(merger.filter(samples, eq)).extracting(Sample::getValue).containsExactly(1.0);

        WhereConditions literal = new WhereConditions();
        literal.setTagLike("PUMP.0_");
        assertThat(merger.filter(samples, literal)).isEmpty();
    }

    @Test
    @DisplayName("Should return the input unchanged without predicates")
    void shouldPassThroughWithoutPredicates() {
        List<Sample> samples = List.of(new Sample("T", "t", "x"));

        assertThat(merger.filter(samples, new WhereConditions())).isSameAs(samples);
        assertThat(merger.filter(samples, null)).isSameAs(samples);
    }
}
