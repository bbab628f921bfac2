package io.hookcron.core;

public enum JobKind {
    ONE_OFF {
        @Override
        public JobStatus statusAfterSuccess() {
            return JobStatus.COMPLETED;
        }
    },
    RECURRING {
        @Override
        public JobStatus statusAfterSuccess() {
            return JobStatus.SCHEDULED;
        }
    };

    public abstract JobStatus statusAfterSuccess();
}
