package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves mirror URLs to the channel URL first discovered to serve the same origin.
 * <p>
 * Workflow (per playlist, channels in source order):
 * <ul>
 *   <li>{@link #register}: after each successful probe, a probe whose first request stays on the
 *       channel's own host is an origin probe and claims every URL of its request chain;
 *       redirect probes claim nothing.</li>
 *   <li>{@link #canonicalize}: once every channel has been probed, each channel URL is rewritten to the
 *       owner of the first claimed key among its own URL and then its chain URLs.</li>
 * </ul>
 * Keys are compared without protocol, so http and https mirrors of one origin collapse.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class OriginCanonicalizer {
    private static final Logger logger = LoggerFactory.getLogger(OriginCanonicalizer.class);

    public enum ProbeType { ORIGIN, REDIRECT }

    /**
     * Decides whether a probe started on the channel's own host.
     * @param channelUrl URL the channel declares
     * @param requestChain URLs the probe requested, first one is the original request
     * @return ORIGIN when both hosts are known and equal, REDIRECT otherwise
     */
    public ProbeType typeOf(String channelUrl, List<String> requestChain) {
        if (requestChain == null || requestChain.isEmpty()) return ProbeType.REDIRECT;
        String own = Utils.hostOf(channelUrl);
        String first = Utils.hostOf(requestChain.get(0));
        return own != null && own.equals(first) ? ProbeType.ORIGIN : ProbeType.REDIRECT;
    }

    /**
     * Claims the request chain of an origin probe for the channel URL.
     * @param channelUrl channel URL before any rewrite
     * @param requestChain chain of the channel's successful probe
     * @param origins origin map of the current pass
     * @return number of newly claimed keys
     */
    public int register(String channelUrl, List<String> requestChain, OriginMap origins) {
        if (requestChain == null || requestChain.isEmpty()) return 0;
        if (typeOf(channelUrl, requestChain) != ProbeType.ORIGIN) return 0;
        int claimed = 0;
        for (String url : requestChain) {
            if (origins.claim(Utils.removeProtocol(url), channelUrl)) claimed++;
        }
        return claimed;
    }

    /**
     * Rewrites the channel URL to its canonical origin if one was registered.
     * @param channel channel with a successful probe
     * @param requestChain chain of that probe
     * @param origins origin map of the current pass
     * @return true if the URL changed
     */
    public boolean canonicalize(Channel channel, List<String> requestChain, OriginMap origins) {
        if (requestChain == null || requestChain.isEmpty()) return false;
        String target = origins.lookup(Utils.removeProtocol(channel.getUrl()));
        if (target == null) {
            for (String request : requestChain) {
                target = origins.lookup(Utils.removeProtocol(request));
                if (target != null) break;
            }
        }
        if (target == null || target.equals(channel.getUrl())) return false;
        logger.debug("Rewriting {} -> {}", channel.getUrl(), target);
        channel.setUrl(target);
        return true;
    }
}
