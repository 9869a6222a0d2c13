package com.work.provenance.server.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;

import java.util.List;

public class AnchorReleaseRequest {

    @NotBlank(message = "projectId 不能为空")
    private String projectId;

    @NotBlank(message = "id 不能为空")
    private String id;

    @NotBlank(message = "context 不能为空")
    private String context;

    @NotBlank(message = "manifestRef 不能为空")
    private String manifestRef;

    @NotBlank(message = "name 不能为空")
    private String name;

    @NotBlank(message = "author 不能为空")
    private String author;

    @NotBlank(message = "governanceAuthority 不能为空")
    private String governanceAuthority;

    @Valid
    @NotEmpty(message = "snapshots 不能为空")
    private List<SnapshotRefRequest> snapshots;

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public String getManifestRef() {
        return manifestRef;
    }

    public void setManifestRef(String manifestRef) {
        this.manifestRef = manifestRef;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getGovernanceAuthority() {
        return governanceAuthority;
    }

    public void setGovernanceAuthority(String governanceAuthority) {
        this.governanceAuthority = governanceAuthority;
    }

    public List<SnapshotRefRequest> getSnapshots() {
        return snapshots;
    }

    public void setSnapshots(List<SnapshotRefRequest> snapshots) {
        this.snapshots = snapshots;
    }
}
