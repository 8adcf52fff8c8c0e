package com.example.teambalancer.generation;

import com.example.teambalancer.allocation.QualityVector;
import com.example.teambalancer.roster.Member;

import java.util.List;

/**
 * Outcome of one {@link TeamGenerator#generate} call: either a full valid
 * partition or a structured failure, never a partial allocation.
 */
public interface GenerationResult {

    boolean isSuccess();

    int attemptsUsed();

    /**
     * @param teams        one list per team, every present member exactly once
     * @param attemptsUsed index of the attempt that produced the returned teams
     * @param attemptsRun  attempts executed before the loop stopped
     */
    record Success(List<List<Member>> teams, int attemptsUsed, int attemptsRun, QualityVector quality)
            implements GenerationResult {

        public Success {
            teams = teams.stream().map(List::copyOf).toList();
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(ErrorKind errorKind, String message, String suggestion, int attemptsUsed)
            implements GenerationResult {

        public static Failure of(ErrorKind kind, int attemptsUsed) {
            return new Failure(kind, kind.getMessage(), kind.getSuggestion(), attemptsUsed);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
