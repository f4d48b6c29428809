package com.keyhive.repositories.mongo;

import com.keyhive.core.KeyRecord;
import org.bson.Document;
import org.bson.types.Binary;

import java.util.Collections;
import java.util.List;

import static com.keyhive.core.KeyRecord.*;

public interface Converters {
    static Document recordToDocument(KeyRecord record) {
        Document doc = new Document();
        doc.put(RFINGERPRINT, record.rfingerprint());
        doc.put(CTIME, record.createdAt());
        doc.put(MTIME, record.modifiedAt());
        doc.put(DIGEST, record.digest());
        doc.put(PACKETS, new Binary(record.packets()));
        doc.put(KEYWORDS, record.keywords());
        return doc;
    }

    static KeyRecord documentToRecord(Document doc) {
        if (doc == null) {
            return null;
        }

        return new KeyRecord(
                doc.getString(RFINGERPRINT),
                epochSeconds(doc.get(CTIME)),
                epochSeconds(doc.get(MTIME)),
                doc.getString(DIGEST),
                packets(doc.get(PACKETS)),
                doc.getList(KEYWORDS, String.class, Collections.emptyList()));
    }

    private static long epochSeconds(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static byte[] packets(Object value) {
        if (value instanceof Binary) {
            return ((Binary) value).getData();
        }
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        return new byte[0];
    }
}
