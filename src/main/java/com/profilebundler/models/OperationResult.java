package com.profilebundler.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one top-level operation (combine, bundle, clean, update). Counts
 * are for reporting only.
 */
public class OperationResult {

    public enum Status {
        OK,
        NOTHING_TO_DO,
        FAILED
    }

    private String operation;
    private Status status = Status.OK;
    private String message;
    private String outputFile;
    private List<String> filesWritten = new ArrayList<>();
    private List<String> filesDeleted = new ArrayList<>();
    private List<String> profilesMoved = new ArrayList<>();
    private List<String> leafProfiles = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
    private List<String> previews = new ArrayList<>();
    private int commonProperties;
    private int referencesRewritten;
    private int profilesChanged;
    private int propertiesRemoved;
    private int filesProcessed;

    public OperationResult() {
    }

    public OperationResult(String operation) {
        this.operation = operation;
    }

    public static OperationResult nothingToDo(String operation, String message) {
        OperationResult result = new OperationResult(operation);
        result.setStatus(Status.NOTHING_TO_DO);
        result.setMessage(message);
        return result;
    }

    public static OperationResult failed(String operation, String message) {
        OperationResult result = new OperationResult(operation);
        result.setStatus(Status.FAILED);
        result.setMessage(message);
        return result;
    }

    public OperationResult fail(String message) {
        this.status = Status.FAILED;
        this.message = message;
        return this;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status != Status.FAILED;
    }

    @JsonIgnore
    public boolean hasChanges() {
        return !filesWritten.isEmpty() || !filesDeleted.isEmpty();
    }

    public void recordWritten(Path file) {
        String value = file.toString();
        if (!filesWritten.contains(value)) {
            filesWritten.add(value);
        }
    }

    public void recordDeleted(Path file) {
        String value = file.toString();
        filesWritten.remove(value);
        if (!filesDeleted.contains(value)) {
            filesDeleted.add(value);
        }
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addPreview(String preview) {
        previews.add(preview);
    }

    public void addPropertiesRemoved(int count) {
        propertiesRemoved += count;
    }

    public void incrementProfilesChanged() {
        profilesChanged++;
    }

    public void incrementReferencesRewritten() {
        referencesRewritten++;
    }

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public List<String> getFilesWritten() {
        return filesWritten;
    }

    public void setFilesWritten(List<String> filesWritten) {
        this.filesWritten = filesWritten != null ? filesWritten : new ArrayList<>();
    }

    public List<String> getFilesDeleted() {
        return filesDeleted;
    }

    public void setFilesDeleted(List<String> filesDeleted) {
        this.filesDeleted = filesDeleted != null ? filesDeleted : new ArrayList<>();
    }

    public List<String> getProfilesMoved() {
        return profilesMoved;
    }

    public void setProfilesMoved(List<String> profilesMoved) {
        this.profilesMoved = profilesMoved != null ? profilesMoved : new ArrayList<>();
    }

    public List<String> getLeafProfiles() {
        return leafProfiles;
    }

    public void setLeafProfiles(List<String> leafProfiles) {
        this.leafProfiles = leafProfiles != null ? leafProfiles : new ArrayList<>();
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<String> warnings) {
        this.warnings = warnings != null ? warnings : new ArrayList<>();
    }

    /**
     * Unified diffs of planned writes when running dry.
     */
    public List<String> getPreviews() {
        return previews;
    }

    public void setPreviews(List<String> previews) {
        this.previews = previews != null ? previews : new ArrayList<>();
    }

    public int getCommonProperties() {
        return commonProperties;
    }

    public void setCommonProperties(int commonProperties) {
        this.commonProperties = commonProperties;
    }

    public int getReferencesRewritten() {
        return referencesRewritten;
    }

    public void setReferencesRewritten(int referencesRewritten) {
        this.referencesRewritten = referencesRewritten;
    }

    public int getProfilesChanged() {
        return profilesChanged;
    }

    public void setProfilesChanged(int profilesChanged) {
        this.profilesChanged = profilesChanged;
    }

    public int getPropertiesRemoved() {
        return propertiesRemoved;
    }

    public void setPropertiesRemoved(int propertiesRemoved) {
        this.propertiesRemoved = propertiesRemoved;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public void setFilesProcessed(int filesProcessed) {
        this.filesProcessed = filesProcessed;
    }
}
