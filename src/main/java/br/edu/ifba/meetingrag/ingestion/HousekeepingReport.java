package br.edu.ifba.meetingrag.ingestion;

public record HousekeepingReport(int purgedTasks, int purgedWebhookEvents) {

    public static HousekeepingReport none() {
        return new HousekeepingReport(0, 0);
    }
}
