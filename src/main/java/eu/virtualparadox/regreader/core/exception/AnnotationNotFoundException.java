package eu.virtualparadox.regreader.core.exception;

public class AnnotationNotFoundException extends RegReaderException {

    private final String regId;
    private final String annotationId;

    public AnnotationNotFoundException(final String regId, final String annotationId) {
        super(ErrorKind.ANNOTATION_NOT_FOUND, "Annotation not found: " + regId + " " + annotationId);
        this.regId = regId;
        this.annotationId = annotationId;
    }

    public String getRegId() {
        return regId;
    }

    public String getAnnotationId() {
        return annotationId;
    }
}
