package ca.uwaterloo.swag.flowlens.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.apache.commons.io.FileUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link FunctionCatalog} reads lists of C function names from XML of the form
 * {@code <functions><function><name>malloc</name></function>...</functions>}.
 *
 * @since 0.0.1
 */
public final class FunctionCatalog {

    public static final String DEFAULT_ALLOCATION_FUNCTIONS_FILE = "common/allocation_functions.xml";
    public static final String DEFAULT_DEALLOCATION_FUNCTIONS_FILE = "common/deallocation_functions.xml";
    private static final Logger log = Logger.getLogger(FunctionCatalog.class.getName());

    private FunctionCatalog() {
    }

    public static List<String> loadResource(String resourceName) {
        try (InputStream functionsInputStream = FunctionCatalog.class.getClassLoader()
            .getResourceAsStream(resourceName)) {
            if (functionsInputStream == null) {
                throw new IllegalArgumentException("Unable to find function catalog resource: " + resourceName);
            }
            return loadFunctionsFromXmlInputStream(functionsInputStream);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            log.log(Level.SEVERE, "Error loading function catalog " + resourceName, e);
            throw new RuntimeException(e);
        }
    }

    public static List<String> loadFile(String functionsFile) {
        File file = new File(functionsFile);
        if (!file.isFile()) {
            throw new IllegalArgumentException("Unable to find XML file of functions: " + functionsFile);
        }
        try (InputStream functionsInputStream = FileUtils.openInputStream(file)) {
            return loadFunctionsFromXmlInputStream(functionsInputStream);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            log.log(Level.SEVERE, "Error loading function catalog " + functionsFile, e);
            throw new RuntimeException(e);
        }
    }

    static List<String> loadFunctionsFromXmlInputStream(InputStream xmlInputStream)
        throws ParserConfigurationException, IOException, SAXException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        DocumentBuilder db = dbf.newDocumentBuilder();
        Document functionsXmlDoc = db.parse(xmlInputStream);
        functionsXmlDoc.getDocumentElement().normalize();

        List<String> functionList = new ArrayList<>();
        NodeList list = functionsXmlDoc.getElementsByTagName("function");
        for (int i = 0; i < list.getLength(); i++) {
            Node node = list.item(i);
            Element element = (Element) node;
            NodeList names = element.getElementsByTagName("name");
            if (names.getLength() == 0) {
                continue;
            }
            String functionName = names.item(0).getTextContent().strip();
            if (!functionName.isEmpty()) {
                functionList.add(functionName);
            }
        }
        return functionList;
    }
}
