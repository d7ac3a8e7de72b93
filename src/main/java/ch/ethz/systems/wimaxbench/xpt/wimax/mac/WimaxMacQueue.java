package ch.ethz.systems.wimaxbench.xpt.wimax.mac;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * FIFO queue of MAC packets belonging to one connection.
 *
 * Packets of different header types share the queue; the query and dequeue
 * operations always address the first packet of the requested type.
 * A packet at the head can be sent in several fragments: each call to
 * {@link #dequeue(MacHeaderType, int)} cuts a fragment off the remaining
 * payload, and the final {@link #dequeue(MacHeaderType)} sends the tail.
 * Capacity is measured in packets.
 */
public class WimaxMacQueue {

    public static final int DEFAULT_MAX_SIZE = 1024;

    private static boolean LOGGING_ENABLED = false;

    private final int maxSize;
    private final Deque<QueueElement> queue;

    // Total bytes required to send everything currently queued
    private long nrBytes;

    private long enqueuedPackets = 0;
    private long dequeuedPackets = 0;
    private long droppedPackets = 0;
    private long fragmentsCreated = 0;

    public WimaxMacQueue() {
        this(DEFAULT_MAX_SIZE);
    }

    /**
     * Constructor.
     *
     * @param maxSize   Maximum number of packets the queue holds
     */
    public WimaxMacQueue(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Queue maximum size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.queue = new ArrayDeque<>();
        this.nrBytes = 0;

        if (Simulator.getConfiguration() != null) {
            LOGGING_ENABLED = Simulator.getConfiguration().getBooleanPropertyWithDefault("enable_log_mac_queue_internal", false);
        }
    }

    /**
     * Add a packet to the tail of the queue.
     *
     * @param packet    Unfragmented MAC packet
     *
     * @return  True iff the packet was enqueued, false if the queue was full (packet dropped)
     */
    public boolean enqueue(MacPacket packet) {
        if (packet.isFragment()) {
            throw new IllegalArgumentException("Only unfragmented packets can be enqueued: " + packet);
        }
        if (queue.size() >= maxSize) {
            droppedPackets++;
            SimulationLogger.increaseStatisticCounter("MAC_QUEUE_PACKETS_DROPPED");
            if (LOGGING_ENABLED) {
                SimulationLogger.logInfo("MAC_QUEUE_DROP", packet.toString());
            }
            return false;
        }
        QueueElement element = new QueueElement(packet);
        queue.addLast(element);
        nrBytes += element.getRequiredBytes();
        enqueuedPackets++;
        return true;
    }

    /**
     * Remove the first packet of the given type. If it was fragmented before,
     * the last fragment carrying the remaining payload is returned.
     *
     * @param packetType    Header type
     *
     * @return  Packet (or last fragment), or null if there is no packet of the type
     */
    public MacPacket dequeue(MacHeaderType packetType) {
        Iterator<QueueElement> iterator = queue.iterator();
        while (iterator.hasNext()) {
            QueueElement element = iterator.next();
            if (element.packet.getHeaderType() == packetType) {
                iterator.remove();
                nrBytes -= element.getRequiredBytes();
                dequeuedPackets++;

                MacPacket packet;
                if (element.fragmented) {
                    packet = element.packet.fragment(element.getRemainingPayload(), FragmentState.LAST, element.fragmentNumber);
                } else {
                    packet = element.packet;
                }
                if (LOGGING_ENABLED) {
                    SimulationLogger.logInfo("MAC_QUEUE_DEQUEUE", packet.toString());
                }
                return packet;
            }
        }
        return null;
    }

    /**
     * Cut a fragment of exactly <code>availableBytes</code> bytes (header, fragmentation
     * subheader and payload) off the first packet of the given type. The packet stays at
     * the head of the queue with its remaining payload.
     *
     * @param packetType        Header type (must be {@link MacHeaderType#GENERIC})
     * @param availableBytes    Size of the fragment in bytes
     *
     * @return  First or middle fragment
     */
    public MacPacket dequeue(MacHeaderType packetType, int availableBytes) {
        if (packetType != MacHeaderType.GENERIC) {
            throw new IllegalArgumentException("Only packets with a generic MAC header can be fragmented");
        }
        QueueElement element = peekElement(packetType);
        if (element == null) {
            throw new IllegalStateException("No packet of type " + packetType + " to fragment");
        }
        int fragmentHeaderBytes = packetType.getHeaderBytes() + MacHeaderType.FRAGMENTATION_SUBHEADER_BYTES;
        int fragmentPayload = availableBytes - fragmentHeaderBytes;
        if (fragmentPayload <= 0) {
            throw new IllegalArgumentException("Fragment of " + availableBytes
                    + " bytes cannot carry payload (header is " + fragmentHeaderBytes + " bytes)");
        }
        if (fragmentPayload >= element.getRemainingPayload()) {
            throw new IllegalArgumentException("Fragment of " + availableBytes
                    + " bytes would carry the entire remaining packet (" + element.getRequiredBytes() + " bytes)");
        }

        long requiredBefore = element.getRequiredBytes();
        FragmentState state = element.fragmentNumber == 0 ? FragmentState.FIRST : FragmentState.MIDDLE;
        MacPacket fragment = element.packet.fragment(fragmentPayload, state, element.fragmentNumber);

        element.fragmented = true;
        element.fragmentNumber++;
        element.fragmentOffset += fragmentPayload;
        nrBytes += element.getRequiredBytes() - requiredBefore;
        fragmentsCreated++;
        SimulationLogger.increaseStatisticCounter("MAC_QUEUE_FRAGMENTS_CREATED");

        if (LOGGING_ENABLED) {
            SimulationLogger.logInfo("MAC_QUEUE_FRAGMENT", fragment + ", remaining payload=" + element.getRemainingPayload());
        }
        return fragment;
    }

    /**
     * Retrieve the first packet of the given type without removing it.
     *
     * @param packetType    Header type
     *
     * @return  Packet as it was enqueued, or null if there is no packet of the type
     */
    public MacPacket peek(MacHeaderType packetType) {
        QueueElement element = peekElement(packetType);
        return element == null ? null : element.packet;
    }

    private QueueElement peekElement(MacHeaderType packetType) {
        for (QueueElement element : queue) {
            if (element.packet.getHeaderType() == packetType) {
                return element;
            }
        }
        return null;
    }

    private QueueElement peekElementOrFail(MacHeaderType packetType) {
        QueueElement element = peekElement(packetType);
        if (element == null) {
            throw new IllegalStateException("Queue holds no packet of type " + packetType);
        }
        return element;
    }

    /**
     * Header size of the first packet of the given type, including the
     * fragmentation subheader if the packet has already been fragmented.
     *
     * @param packetType    Header type
     *
     * @return  Header size in bytes
     */
    public int getFirstPacketHdrSize(MacHeaderType packetType) {
        return peekElementOrFail(packetType).getHeaderBytes();
    }

    /**
     * Payload of the first packet of the given type which has not been sent yet.
     *
     * @param packetType    Header type
     *
     * @return  Remaining payload in bytes (zero for bandwidth requests)
     */
    public int getFirstPacketPayloadSize(MacHeaderType packetType) {
        return peekElementOrFail(packetType).getRemainingPayload();
    }

    /**
     * Bytes required to send the first packet of the given type in one piece.
     *
     * @param packetType    Header type
     *
     * @return  Header size plus remaining payload in bytes
     */
    public int getFirstPacketRequiredByte(MacHeaderType packetType) {
        return peekElementOrFail(packetType).getRequiredBytes();
    }

    /**
     * Check whether the first packet of the given type has already been fragmented.
     *
     * @param packetType    Header type
     *
     * @return  True iff at least one fragment of it has been sent
     */
    public boolean checkForFragmentation(MacHeaderType packetType) {
        return peekElementOrFail(packetType).fragmented;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public boolean isEmpty(MacHeaderType packetType) {
        return peekElement(packetType) == null;
    }

    public int getSize() {
        return queue.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Total bytes required to send all queued packets.
     *
     * @return  Queued bytes
     */
    public long getNBytes() {
        return nrBytes;
    }

    public long getEnqueuedPacketCount() {
        return enqueuedPackets;
    }

    public long getDequeuedPacketCount() {
        return dequeuedPackets;
    }

    public long getDroppedPacketCount() {
        return droppedPackets;
    }

    public long getFragmentsCreatedCount() {
        return fragmentsCreated;
    }

    /**
     * Queue slot: a packet plus its fragmentation progress.
     */
    private static class QueueElement {

        private final MacPacket packet;
        private boolean fragmented;
        private int fragmentNumber;
        private int fragmentOffset;

        QueueElement(MacPacket packet) {
            this.packet = packet;
            this.fragmented = false;
            this.fragmentNumber = 0;
            this.fragmentOffset = 0;
        }

        int getHeaderBytes() {
            int size = packet.getHeaderType().getHeaderBytes();
            if (fragmented) {
                size += MacHeaderType.FRAGMENTATION_SUBHEADER_BYTES;
            }
            return size;
        }

        int getRemainingPayload() {
            return packet.getPayloadBytes() - fragmentOffset;
        }

        int getRequiredBytes() {
            return getHeaderBytes() + getRemainingPayload();
        }

    }

}
