package io.muse.persistence.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoDatabase;

/** Database of one request plus its client session, or {@code null} when sessions are disabled. */
record MongoReadSession(MongoDatabase db, ClientSession session) {}
