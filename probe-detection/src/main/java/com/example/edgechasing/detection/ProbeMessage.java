package com.example.edgechasing.detection;

/**
 * Edge-chasing probe: who started the round, who sent this hop, who receives it.
 */
public record ProbeMessage(int initiator, int sender, int receiver) {

    /** Next hop of the same round. The initiator never changes. */
    public ProbeMessage forward(int newSender, int newReceiver) {
        return new ProbeMessage(initiator, newSender, newReceiver);
    }

    public boolean initiatedBy(int processId) {
        return initiator == processId;
    }
}
