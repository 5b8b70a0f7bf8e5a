package edu.harvard.hms.dbmi.avillach.tsformat.data.dataset;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Optional;

/**
 * Annotations of a single column of a resource.
 *
 * Location base uris are only meaningful on a column that is the target of a file name column's
 * foreign key; they give the root under which the referenced files are stored.
 */
public record ColumnMetadata(
    String name,
    StructuralType structuralType,
    ImmutableSet<String> semanticTypes,
    ImmutableSet<String> mediaTypes,
    @Nullable ForeignKey foreignKey,
    ImmutableList<String> locationBaseUris
) {

    public ColumnMetadata {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(structuralType, "structuralType");
        semanticTypes = semanticTypes == null ? ImmutableSet.of() : semanticTypes;
        mediaTypes = mediaTypes == null ? ImmutableSet.of() : mediaTypes;
        locationBaseUris = locationBaseUris == null ? ImmutableList.of() : locationBaseUris;
    }

    public static ColumnMetadata of(String name, StructuralType structuralType) {
        return new ColumnMetadata(name, structuralType, ImmutableSet.of(), ImmutableSet.of(), null, ImmutableList.of());
    }

    public ColumnMetadata withSemanticTypes(Collection<String> types) {
        return new ColumnMetadata(name, structuralType, ImmutableSet.copyOf(types), mediaTypes, foreignKey, locationBaseUris);
    }

    public ColumnMetadata withMediaTypes(Collection<String> types) {
        return new ColumnMetadata(name, structuralType, semanticTypes, ImmutableSet.copyOf(types), foreignKey, locationBaseUris);
    }

    public ColumnMetadata withForeignKey(@Nullable ForeignKey key) {
        return new ColumnMetadata(name, structuralType, semanticTypes, mediaTypes, key, locationBaseUris);
    }

    public ColumnMetadata withLocationBaseUris(Collection<String> uris) {
        return new ColumnMetadata(name, structuralType, semanticTypes, mediaTypes, foreignKey, ImmutableList.copyOf(uris));
    }

    public Optional<ForeignKey> getForeignKey() {
        return Optional.ofNullable(foreignKey);
    }

    public boolean hasAnySemanticType(Collection<String> types) {
        return types.stream().anyMatch(semanticTypes::contains);
    }
}
