package com.questrail.arena.ingest.resolve;

import java.util.Optional;

/**
 * Remote card metadata service, addressed by grpId.
 */
@FunctionalInterface
public interface RemoteCardLookup
{
    /**
     * @return the card, or empty if the service does not know the id
     * @throws RemoteLookupException if the service could not be reached or
     *         answered with an error
     */
    Optional<ResolvedCard> lookup(int grpId);
}
