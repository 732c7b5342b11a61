package io.github.samzhu.timesheet.service;

import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.document.FetchCheckpoint;
import io.github.samzhu.timesheet.dto.asana.AsanaProject;
import io.github.samzhu.timesheet.repository.FetchCheckpointRepository;

/**
 * 增量抓取的專案進度管理。
 *
 * <p>進度只在專案的任務全部寫入後才推進，且推進到抓取的開始時間而非寫入時間：
 * <ul>
 *   <li>專案被略過或抓取中止 → 進度不變，下次從原本的時間點重抓</li>
 *   <li>分批執行 → 各批次只推進自己處理過的專案</li>
 * </ul>
 */
@Service
public class FetchCheckpointService {

    private static final Logger log = LoggerFactory.getLogger(FetchCheckpointService.class);

    private final FetchCheckpointRepository repository;

    public FetchCheckpointService(FetchCheckpointRepository repository) {
        this.repository = repository;
    }

    /**
     * 取得專案的增量起點。
     *
     * @param projectId 專案 gid
     * @return 上次成功抓取的開始時間，從未成功處理時為 empty
     */
    public Optional<Instant> since(String projectId) {
        return repository.findById(projectId).map(FetchCheckpoint::fetchStartedAt);
    }

    /**
     * 推進專案進度。
     *
     * @param project 已處理完成的專案
     * @param fetchStartedAt 本次抓取的開始時間
     */
    public void advance(AsanaProject project, Instant fetchStartedAt) {
        repository.save(new FetchCheckpoint(project.gid(), project.name(), fetchStartedAt));
        log.debug("Checkpoint for project '{}' advanced to {}", project.name(), fetchStartedAt);
    }
}
