package work.lcod.worlddata.load;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * {@link DocumentLoader} for XML definition files:
 *
 * <pre>{@code
 * <objects>
 *   <object> ... </object>
 *   <object> ... </object>
 * </objects>
 * }</pre>
 *
 * Each {@code object} element is bound with Jackson's XML module. Other children of the root are ignored.
 */
public final class XmlDocumentLoader implements DocumentLoader {
    public static final String OBJECT_ELEMENT = "object";

    private final XmlMapper mapper;

    public XmlDocumentLoader() {
        this(defaultMapper());
    }

    public XmlDocumentLoader(XmlMapper mapper) {
        this.mapper = mapper;
    }

    public static XmlMapper defaultMapper() {
        XmlMapper mapper = new XmlMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Override
    public <T> List<T> loadObjects(byte[] document, String path, Class<T> type) {
        XMLInputFactory factory = mapper.getFactory().getXMLInputFactory();
        List<T> objects = new ArrayList<>();
        try {
            XMLStreamReader reader = factory.createXMLStreamReader(new ByteArrayInputStream(document));
            if (reader.nextTag() != XMLStreamConstants.START_ELEMENT) {
                throw new DefinitionLoadException("No root element found", path);
            }
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.END_ELEMENT) {
                    break;
                }
                if (event != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                if (OBJECT_ELEMENT.equals(reader.getLocalName())) {
                    T value = mapper.readValue(reader, type);
                    if (value == null) {
                        throw new DefinitionLoadException("Empty " + type.getSimpleName() + " object", path);
                    }
                    objects.add(value);
                } else {
                    skipElement(reader);
                }
            }
            reader.close();
            return objects;
        } catch (XMLStreamException | IOException ex) {
            throw new DefinitionLoadException("Failed to parse " + type.getSimpleName() + " document: "
                + ex.getMessage(), path, ex);
        }
    }

    private static void skipElement(XMLStreamReader reader) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
    }
}
