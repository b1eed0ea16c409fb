package com.evidex.core.search;

import com.evidex.core.dao.EvidenceFileRecord;

/** An image in which the reference person was recognised. */
public record FaceHit(EvidenceFileRecord file, IdentityMatch match) {
}
