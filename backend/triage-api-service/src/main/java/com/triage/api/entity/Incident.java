package com.triage.api.entity;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.Map;

/** Ids are assigned before saving, so newness is tracked here instead of inferred from the id. */
@Entity
@Table(name = "incidents")
public class Incident implements Persistable<String> {
  @Id
  private String id;

  @Column(nullable = false) private Instant createdAt;
  private String name;
  private String source;

  @Convert(converter = MetaJsonConverter.class)
  @Column(name = "metadata", length = 8192)
  private Map<String, Object> meta;

  @Transient
  private boolean fresh = true;

  protected Incident() {}

  public Incident(String id, String name, String source, Map<String, Object> meta, Instant createdAt) {
    this.id = id;
    this.name = name;
    this.source = source;
    this.meta = meta;
    this.createdAt = createdAt;
  }

  @PostLoad
  @PrePersist
  void markStored() {
    this.fresh = false;
  }

  @Override
  public boolean isNew() { return fresh; }

  @Override
  public String getId() { return id; }
  public Instant getCreatedAt() { return createdAt; }
  public String getName() { return name; }
  public String getSource() { return source; }
  public Map<String, Object> getMeta() { return meta; }
}
