package com.mailbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Log of one recursive extraction run. Rounds are only ever appended.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRecord {

    private List<Round> rounds = new ArrayList<>();
    private int totalExtracted;
    private List<String> errors = new ArrayList<>();
    private boolean depthExceeded;

    public Round startRound(int number, int archivesFound) {
        Round round = new Round();
        round.setRound(number);
        round.setArchivesFound(archivesFound);
        rounds.add(round);
        return round;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Round {
        private int round;
        private int archivesFound;
        private List<ArchiveOutcome> extracted = new ArrayList<>();
        private List<String> skipped = new ArrayList<>();
        private List<String> errors = new ArrayList<>();
    }

    /**
     * Files written from one archive; error is set when extraction stopped partway
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ArchiveOutcome {
        private String archive;
        private String extractedTo;
        private List<String> files = new ArrayList<>();
        private String error;
    }
}
