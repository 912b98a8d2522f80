package com.edgeroute.proxy.core.loadbalancer;

import com.edgeroute.proxy.core.routing.BackendTarget;
import com.edgeroute.proxy.core.routing.ResolvedPool;
import com.edgeroute.proxy.spi.LoadBalancer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Sticky selection based on the CRC32 of the client IP.
 * A client keeps its backend as long as the expanded pool is unchanged.
 */
public class IpHashLoadBalancer implements LoadBalancer {

    /** Hashed in place of a missing client address. */
    public static final String FALLBACK_ADDRESS = "127.0.0.1";

    @Override
    public BackendTarget select(ResolvedPool pool, SelectionContext context) {
        String clientIp = context.clientIp();
        if (clientIp == null || clientIp.isEmpty()) {
            clientIp = FALLBACK_ADDRESS;
        }
        int index = (int) (crc32(clientIp) % pool.size());
        return pool.get(index);
    }

    /**
     * Computes the unsigned CRC32 of a string's UTF-8 bytes.
     *
     * @param value Input string.
     * @return Checksum in {@code [0, 2^32)}.
     */
    static long crc32(String value) {
        CRC32 crc = new CRC32();
        crc.update(value.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
