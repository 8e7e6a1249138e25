package com.example.datalake.docqa.service;

import com.example.datalake.docqa.model.RoleTag;

import java.util.Set;
import java.util.UUID;

/** Resolves which documents a role may retrieve from. */
public interface AccessFilterProvider {

    Set<UUID> visibleDocumentIds(RoleTag role);
}
