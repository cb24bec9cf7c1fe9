package com.participant.matching.index;

/**
 * Counters gathered while building a {@link ReferenceIndex}.
 *
 * @param collectionsRead        reference collections scanned
 * @param documentsRead          documents streamed from the source
 * @param demographicRecords     demographic records accepted
 * @param residentialRecords     residential records accepted
 * @param skippedNoParcelId      documents dropped for lacking a parcel id
 * @param sameCountyCollisions   keys already held by a record of the same county
 * @param crossCountyCollisions  keys already held by a record of another county
 */
public record IndexBuildStats(
        int collectionsRead,
        long documentsRead,
        long demographicRecords,
        long residentialRecords,
        long skippedNoParcelId,
        long sameCountyCollisions,
        long crossCountyCollisions
) {
    public static IndexBuildStats empty() {
        return new IndexBuildStats(0, 0, 0, 0, 0, 0, 0);
    }

    public long totalCollisions() {
        return sameCountyCollisions + crossCountyCollisions;
    }
}
