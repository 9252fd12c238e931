package org.springaicommunity.github.extractor.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.extractor.AuditEntry;
import org.springaicommunity.github.extractor.EnvironmentSupport;
import org.springaicommunity.github.extractor.ExtractionValidationException;
import org.springaicommunity.github.extractor.ExtractorTool;
import org.springaicommunity.github.extractor.JobRegistry;
import org.springaicommunity.github.extractor.JobSnapshot;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for extraction jobs.
 */
@RestController
@RequestMapping("/api")
public class ExtractionController {

	private static final Logger logger = LoggerFactory.getLogger(ExtractionController.class);

	static final int AUDIT_LIMIT = 100;

	private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

	private final JobRegistry jobRegistry;

	public ExtractionController(JobRegistry jobRegistry) {
		this.jobRegistry = jobRegistry;
	}

	/**
	 * Submit a job.
	 *
	 * POST /api/extract
	 */
	@PostMapping("/extract")
	public ResponseEntity<ExtractResponse> extract(@RequestBody ExtractRequest request) {
		ExtractorTool tool = ExtractorTool.fromId(request.type());
		String credential = EnvironmentSupport.credentialOrEnv(request.token());
		Map<String, Object> args = request.args() != null ? request.args() : Map.of();
		String jobId = jobRegistry.submit(tool, args, credential);
		return ResponseEntity.ok(new ExtractResponse(jobId));
	}

	/**
	 * GET /api/status/{jobId}
	 */
	@GetMapping("/status/{jobId}")
	public ResponseEntity<?> status(@PathVariable String jobId) {
		Optional<JobSnapshot> snapshot = jobRegistry.status(jobId);
		if (snapshot.isEmpty()) {
			return unknownJob();
		}
		return ResponseEntity.ok(JobStatusResponse.from(snapshot.get()));
	}

	/**
	 * GET /api/outputs/{jobId}
	 */
	@GetMapping("/outputs/{jobId}")
	public ResponseEntity<?> outputs(@PathVariable String jobId) {
		Optional<List<String>> outputs = jobRegistry.outputs(jobId);
		if (outputs.isEmpty()) {
			return unknownJob();
		}
		return ResponseEntity.ok(outputs.get());
	}

	/**
	 * Download an announced output file.
	 *
	 * GET /api/download/{jobId}/{filename}
	 */
	@GetMapping("/download/{jobId}/{filename}")
	public ResponseEntity<?> download(@PathVariable String jobId, @PathVariable String filename) {
		if (jobRegistry.status(jobId).isEmpty()) {
			return unknownJob();
		}
		Optional<Path> file = jobRegistry.resolveOutput(jobId, filename);
		if (file.isEmpty()) {
			return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("File not found"));
		}
		Resource resource = new FileSystemResource(file.get());
		return ResponseEntity.ok()
			.contentType(TEXT_CSV)
			.header(HttpHeaders.CONTENT_DISPOSITION,
					ContentDisposition.attachment().filename(file.get().getFileName().toString()).build().toString())
			.body(resource);
	}

	/**
	 * Most recent audit records, oldest first.
	 *
	 * GET /api/audit
	 */
	@GetMapping("/audit")
	public List<AuditEntry> audit() {
		return jobRegistry.recentAudit(AUDIT_LIMIT);
	}

	/**
	 * GET /api/jobs
	 */
	@GetMapping("/jobs")
	public List<JobSnapshot> jobs() {
		return jobRegistry.list();
	}

	@ExceptionHandler(ExtractionValidationException.class)
	public ResponseEntity<ErrorResponse> handleValidation(ExtractionValidationException e) {
		logger.info("Rejected submission: {}", e.getMessage());
		return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
	}

	private static ResponseEntity<ErrorResponse> unknownJob() {
		return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("Unknown job_id"));
	}

}
