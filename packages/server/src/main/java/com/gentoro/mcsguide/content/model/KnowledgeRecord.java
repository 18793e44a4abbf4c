package com.gentoro.mcsguide.content.model;

/**
 * A read-only knowledge base entry. Every record is addressed by a key that is unique within its
 * kind: the {@code id} for most kinds, the {@code feature} name for governance entries.
 */
public interface KnowledgeRecord {

  String key();

  String title();
}
