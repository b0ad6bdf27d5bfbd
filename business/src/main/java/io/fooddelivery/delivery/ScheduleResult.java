package io.fooddelivery.delivery;

public sealed interface ScheduleResult permits ScheduleResult.Scheduled, ScheduleResult.Rejected {

    boolean success();

    record Scheduled(ScheduledOrder order) implements ScheduleResult {
        @Override
        public boolean success() {
            return true;
        }
    }

    record Rejected(String message) implements ScheduleResult {
        @Override
        public boolean success() {
            return false;
        }
    }
}
