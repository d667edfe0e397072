package org.astx.serialization;

import org.astx.api.InvalidValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry mapping variant tags to decoder instances.
 * <p>
 * A tag is the part of a structural key before the first '['. Lookups are exact;
 * an unknown tag has no fallback.
 */
public final class NodeDecoderRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(NodeDecoderRegistry.class);

    private final Map<String, NodeDecoder> byTag = new HashMap<>();

    private NodeDecoderRegistry() {}

    /**
     * Registers a decoder, replacing any decoder already registered for the tag.
     *
     * @param tag     The variant tag, for example {@code "BinaryOp"}.
     * @param decoder The decoder handling that tag.
     */
    public void register(String tag, NodeDecoder decoder) {
        byTag.put(tag, decoder);
    }

    /**
     * @param tag The variant tag to look up.
     * @return Optional decoder if present.
     */
    public Optional<NodeDecoder> get(String tag) {
        return Optional.ofNullable(byTag.get(tag));
    }

    /**
     * @return The decoder for the tag.
     * @throws InvalidValueException if no decoder is registered for it.
     */
    public NodeDecoder resolve(String tag) {
        NodeDecoder decoder = byTag.get(tag);
        if (decoder == null) {
            throw new InvalidValueException("Unknown node tag: " + tag);
        }
        return decoder;
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(byTag.keySet());
    }

    /**
     * @return An empty registry; callers register their own decoders.
     */
    public static NodeDecoderRegistry initialize() {
        return new NodeDecoderRegistry();
    }

    /**
     * @return A registry pre-populated with decoders for every built-in node variant.
     */
    public static NodeDecoderRegistry initializeWithDefaults() {
        NodeDecoderRegistry reg = initialize();
        TypeDecoders.install(reg);
        LiteralDecoders.install(reg);
        ExpressionDecoders.install(reg);
        StatementDecoders.install(reg);
        LOG.debug("Registered {} default node decoders", reg.byTag.size());
        return reg;
    }
}
