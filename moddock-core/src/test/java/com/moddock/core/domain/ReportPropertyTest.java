package com.moddock.core.domain;

import com.moddock.core.domain.ReportTarget.ItemType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for Report and its target.
 *
 * A report points at exactly one item, or at nothing; the stored columns
 * always rebuild the target the report was filed with.
 */
class ReportPropertyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Property(tries = 200)
    void storedColumnsRebuildTheTarget(@ForAll("targets") ReportTarget target) {
        Report report = Report.file(1L, 1, target, "body", 7L, 9L, NOW);

        assertThat(report.getTarget()).isEqualTo(target);
        assertThat(report.getTarget().itemType()).isEqualTo(target.itemType());
    }

    @Property(tries = 100)
    void onlyUserTargetsMatchTargetsUser(
            @ForAll @LongRange(min = 1) long targetId,
            @ForAll("itemTypes") ItemType itemType) {
        Report report = Report.file(1L, 1, ReportTarget.of(itemType, targetId), "body", 7L, 9L, NOW);

        assertThat(report.targetsUser(targetId)).isEqualTo(itemType == ItemType.USER);
    }

    @Property(tries = 100)
    void newReportsAreOpen(@ForAll("targets") ReportTarget target) {
        Report report = Report.file(1L, 2, target, "spam spam", 7L, 9L, NOW);

        assertThat(report.isClosed()).isFalse();
        assertThat(report.isFiledBy(7L)).isTrue();
        assertThat(report.isFiledBy(8L)).isFalse();
    }

    @Example
    void closeAndReopenFlipTheFlag() {
        Report report = Report.file(1L, 1, ReportTarget.none(), "body", 7L, 9L, NOW);

        report.close();
        assertThat(report.isClosed()).isTrue();
        report.close();
        assertThat(report.isClosed()).isTrue();
        report.reopen();
        assertThat(report.isClosed()).isFalse();
    }

    @Property(tries = 20)
    void replaceBodyRejectsOversizedText(
            @ForAll @IntRange(min = 1, max = 64) int excess) {
        Report report = Report.file(1L, 1, ReportTarget.none(), "body", 7L, 9L, NOW);
        String oversized = "x".repeat(Report.MAX_BODY_LENGTH + excess);

        assertThatThrownBy(() -> report.replaceBody(oversized))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(report.getBody()).isEqualTo("body");
    }

    @Example
    void replaceBodyAcceptsTheMaximumLength() {
        Report report = Report.file(1L, 1, ReportTarget.none(), "body", 7L, 9L, NOW);
        String longest = "y".repeat(Report.MAX_BODY_LENGTH);

        report.replaceBody(longest);

        assertThat(report.getBody()).hasSize(Report.MAX_BODY_LENGTH);
    }

    @Example
    void emptyColumnsMeanNoTarget() {
        ReportTarget target = ReportTarget.fromColumns(null, null, null);

        assertThat(target).isInstanceOf(ReportTarget.None.class);
        assertThat(target.itemType()).isEqualTo(ItemType.UNKNOWN);
    }

    @Example
    void itemTypeParsingIsCaseInsensitive() {
        assertThat(ItemType.fromValue("Project")).isEqualTo(ItemType.PROJECT);
        assertThat(ItemType.fromValue("VERSION")).isEqualTo(ItemType.VERSION);
        assertThat(ItemType.fromValue("user")).isEqualTo(ItemType.USER);
        assertThat(ItemType.fromValue("organization")).isEqualTo(ItemType.UNKNOWN);
        assertThat(ItemType.fromValue(null)).isEqualTo(ItemType.UNKNOWN);
    }

    @Provide
    Arbitrary<ReportTarget> targets() {
        Arbitrary<Long> ids = Arbitraries.longs().between(1, Long.MAX_VALUE);
        return Arbitraries.oneOf(
                ids.map(ReportTarget.Project::new),
                ids.map(ReportTarget.Version::new),
                ids.map(ReportTarget.User::new),
                Arbitraries.just(ReportTarget.none())
        );
    }

    @Provide
    Arbitrary<ItemType> itemTypes() {
        return Arbitraries.of(ItemType.PROJECT, ItemType.VERSION, ItemType.USER);
    }
}
