package com.example.assetembed.model;

import javax.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "embedding_task")
public class EmbeddingTaskEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_uuid", nullable = false, unique = true, length = 64)
    private String taskUuid;

    @Column(name = "status", length = 20)
    private String status;

    @Column(name = "page_count")
    private Integer pageCount;

    @Column(name = "pages_succeeded")
    private Integer pagesSucceeded;

    @Column(name = "pages_failed")
    private Integer pagesFailed;

    @Column(name = "assets_inlined")
    private Integer assetsInlined;

    @Column(name = "assets_external")
    private Integer assetsExternal;

    @Column(name = "assets_uploaded")
    private Integer assetsUploaded;

    @Column(name = "requests_saved")
    private Integer requestsSaved;

    @Column(name = "bytes_before")
    private Long bytesBefore;

    @Column(name = "bytes_after")
    private Long bytesAfter;

    // 以 JSON 形式保存全局选项
    @Column(name = "global_options", columnDefinition = "TEXT")
    private String globalOptionsJson;

    @Column(name = "errors", columnDefinition = "TEXT")
    private String errorsText;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "thread_name", length = 100)
    private String threadName;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getTaskUuid() { return taskUuid; }
    public void setTaskUuid(String taskUuid) { this.taskUuid = taskUuid; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public Integer getPageCount() { return pageCount; }
    public void setPageCount(Integer pageCount) { this.pageCount = pageCount; }
    public Integer getPagesSucceeded() { return pagesSucceeded; }
    public void setPagesSucceeded(Integer pagesSucceeded) { this.pagesSucceeded = pagesSucceeded; }
    public Integer getPagesFailed() { return pagesFailed; }
    public void setPagesFailed(Integer pagesFailed) { this.pagesFailed = pagesFailed; }
    public Integer getAssetsInlined() { return assetsInlined; }
    public void setAssetsInlined(Integer assetsInlined) { this.assetsInlined = assetsInlined; }
    public Integer getAssetsExternal() { return assetsExternal; }
    public void setAssetsExternal(Integer assetsExternal) { this.assetsExternal = assetsExternal; }
    public Integer getAssetsUploaded() { return assetsUploaded; }
    public void setAssetsUploaded(Integer assetsUploaded) { this.assetsUploaded = assetsUploaded; }
    public Integer getRequestsSaved() { return requestsSaved; }
    public void setRequestsSaved(Integer requestsSaved) { this.requestsSaved = requestsSaved; }
    public Long getBytesBefore() { return bytesBefore; }
    public void setBytesBefore(Long bytesBefore) { this.bytesBefore = bytesBefore; }
    public Long getBytesAfter() { return bytesAfter; }
    public void setBytesAfter(Long bytesAfter) { this.bytesAfter = bytesAfter; }
    public String getGlobalOptionsJson() { return globalOptionsJson; }
    public void setGlobalOptionsJson(String globalOptionsJson) { this.globalOptionsJson = globalOptionsJson; }
    public String getErrorsText() { return errorsText; }
    public void setErrorsText(String errorsText) { this.errorsText = errorsText; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public String getThreadName() { return threadName; }
    public void setThreadName(String threadName) { this.threadName = threadName; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}
