package com.questrail.sensorlink.protocol.datapoint.codec.impl;

import com.questrail.sensorlink.observability.FrameDefectEvent;
import com.questrail.sensorlink.observability.NullObservabilitySink;
import com.questrail.sensorlink.observability.SensorLinkObservabilitySink;
import com.questrail.sensorlink.protocol.datapoint.codec.DataPointFrameDecoder;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import com.questrail.sensorlink.time.SystemWallClock;
import com.questrail.sensorlink.time.WallClock;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * DefaultDataPointFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DataPointFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Unwrapping to bytes ({@link PayloadUnwrapper})</li>
 *   <li>Lazy framing over a Netty {@link ByteBuf} ({@link DataPointFraming})</li>
 *   <li>Type code resolution; unknown codes skip the frame</li>
 * </ol>
 *
 * <p>Truncation ends the batch: frames already read are kept, the remainder
 * is discarded and a {@link FrameDefectEvent.Kind#TRUNCATED} defect is
 * reported. Nothing is thrown for inbound data.</p>
 */
public final class DefaultDataPointFrameDecoder implements DataPointFrameDecoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultDataPointFrameDecoder.class);

    private final PayloadUnwrapper unwrapper;
    private final SensorLinkObservabilitySink sink;
    private final WallClock wallClock;

    public DefaultDataPointFrameDecoder()
    {
        this(new PayloadUnwrapper(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public DefaultDataPointFrameDecoder(PayloadUnwrapper unwrapper,
                                        SensorLinkObservabilitySink sink,
                                        WallClock wallClock)
    {
        this.unwrapper = Objects.requireNonNull(unwrapper, "unwrapper");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public Stream<DataPointRecord> decode(Object input)
    {
        final Optional<PayloadUnwrapper.Unwrapped> unwrapped = unwrapper.unwrap(input);
        if (unwrapped.isEmpty()) {
            final String detail = "unreadable payload of type " + input.getClass().getName();
            log.warn("Dropping DataPoint batch: {}", detail);
            report(FrameDefectEvent.Kind.UNREADABLE_INPUT, -1, detail);
            return Stream.empty();
        }

        final byte[] bytes = unwrapped.get().bytes();
        if (bytes.length == 0) {
            return Stream.empty();
        }
        log.trace("Decoding {} byte(s) unwrapped from {}", bytes.length, unwrapped.get().encoding());

        return StreamSupport.stream(new FrameSpliterator(Unpooled.wrappedBuffer(bytes)), false);
    }

    private void report(FrameDefectEvent.Kind kind, int dataPointId, String detail)
    {
        sink.onFrameDefect(new FrameDefectEvent(wallClock.now(), kind, dataPointId, detail));
    }

    /**
     * Pulls one frame per advance. Ends at buffer exhaustion or truncation.
     */
    private final class FrameSpliterator extends Spliterators.AbstractSpliterator<DataPointRecord>
    {
        private final ByteBuf buf;
        private boolean done;

        FrameSpliterator(ByteBuf buf)
        {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.buf = buf;
        }

        @Override
        public boolean tryAdvance(Consumer<? super DataPointRecord> action)
        {
            while (!done && buf.isReadable()) {
                final DataPointFraming.Frame frame;
                try {
                    frame = DataPointFraming.readFrame(buf);
                }
                catch (FramingException e) {
                    final int discarded = buf.readableBytes();
                    buf.skipBytes(discarded);
                    done = true;
                    log.warn("Malformed DataPoint frame, discarding {} trailing byte(s): {}", discarded, e.getMessage());
                    report(FrameDefectEvent.Kind.TRUNCATED, -1, e.getMessage());
                    return false;
                }

                final Optional<DataPointType> type = DataPointType.fromCode(frame.typeCode());
                if (type.isEmpty()) {
                    final String detail = String.format("unknown type code 0x%02x, %d byte payload skipped",
                            frame.typeCode(), frame.payload().length);
                    log.warn("DataPoint {}: {}", frame.id(), detail);
                    report(FrameDefectEvent.Kind.UNKNOWN_TYPE, frame.id(), detail);
                    continue;
                }

                action.accept(new DataPointRecord(frame.id(), type.get(), frame.payload()));
                return true;
            }
            done = true;
            return false;
        }
    }
}
